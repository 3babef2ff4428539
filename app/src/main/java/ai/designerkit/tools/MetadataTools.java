package ai.designerkit.tools;

import ai.designerkit.util.Json;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/** Answers questions about control types from the curated catalog bundled as {@code catalog/controls.json}. */
public final class MetadataTools {
    private static final Logger logger = LogManager.getLogger(MetadataTools.class);

    static final String CATALOG_RESOURCE = "/catalog/controls.json";

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PropertyInfo(String name, String type, String description) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record EventInfo(String name, String description) {}

    /**
     * One catalog entry. {@code summary} is the one-liner shown in listings; the remaining fields are only present for
     * types with detailed metadata.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ControlType(
            String name,
            String fullName,
            String category,
            String summary,
            @Nullable String description,
            @Nullable List<PropertyInfo> commonProperties,
            @Nullable List<EventInfo> commonEvents) {
        boolean hasDetails() {
            return description != null;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Catalog(List<ControlType> controls) {}

    private final List<ControlType> catalog;

    public MetadataTools() {
        this.catalog = loadCatalog();
    }

    /** Every catalogued type with its category and a one-line description, in catalog order. */
    public String availableControlTypes() {
        var listing = catalog.stream()
                .map(type -> {
                    Map<String, Object> entry = new LinkedHashMap<>();
                    entry.put("name", type.name());
                    entry.put("fullName", type.fullName());
                    entry.put("category", type.category());
                    entry.put("description", type.summary());
                    return entry;
                })
                .toList();
        return Json.toJson(listing);
    }

    /**
     * Detailed metadata for one type: common properties with their types, and common events. Accepts the short name
     * or the {@code System.Windows.Forms.}-qualified one, ignoring case.
     */
    public String controlTypeInfo(String controlType) {
        var details = find(controlType).filter(ControlType::hasDetails);
        if (details.isEmpty()) {
            return Json.error("No metadata available for '%s'. Use control-types to see known types."
                    .formatted(controlType));
        }
        var type = details.get();
        var result = new LinkedHashMap<String, Object>();
        result.put("name", type.name());
        result.put("fullName", type.fullName());
        result.put("category", type.category());
        result.put("description", type.description());
        result.put("commonProperties", type.commonProperties());
        result.put("commonEvents", type.commonEvents());
        return Json.toJson(result);
    }

    public Optional<ControlType> find(String controlType) {
        var key = controlType.strip();
        if (key.startsWith(LayoutTools.FORMS_NAMESPACE)) {
            key = key.substring(LayoutTools.FORMS_NAMESPACE.length());
        }
        for (var type : catalog) {
            if (type.name().equalsIgnoreCase(key)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    public List<ControlType> catalog() {
        return catalog;
    }

    private static List<ControlType> loadCatalog() {
        try (var in = MetadataTools.class.getResourceAsStream(CATALOG_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Control catalog resource missing: " + CATALOG_RESOURCE);
            }
            var catalog = Json.getMapper().readValue(in, Catalog.class);
            logger.debug("Loaded {} control types from {}", catalog.controls().size(), CATALOG_RESOURCE);
            return List.copyOf(catalog.controls());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read control catalog " + CATALOG_RESOURCE, e);
        }
    }
}
