package ai.designerkit.util;

import static org.junit.jupiter.api.Assertions.*;

import ai.designerkit.analyzer.Dialect;
import ai.designerkit.util.ValueExpressions.IntPair;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import org.junit.jupiter.api.Test;

public class ValueExpressionsTest {

    @Test
    void testArgumentsSplitOnTopLevelCommas() {
        assertEquals(Optional.of(List.of("75", "23")), ValueExpressions.arguments("new System.Drawing.Size(75, 23)"));
        assertEquals(
                Optional.of(List.of("\"Segoe UI\"", "9F", "System.Drawing.FontStyle.Regular")),
                ValueExpressions.arguments(
                        "new System.Drawing.Font(\"Segoe UI\", 9F, System.Drawing.FontStyle.Regular)"));
        assertEquals(
                Optional.of(List.of("Foo(1, 2)", "new[] { 3, 4 }")),
                ValueExpressions.arguments("new Bar(Foo(1, 2), new[] { 3, 4 })"));
    }

    @Test
    void testArgumentsIgnoreDelimitersInStrings() {
        assertEquals(
                Optional.of(List.of("\"a, (b\"", "1")),
                ValueExpressions.arguments("Make(\"a, (b\", 1)"));
        assertEquals(
                Optional.of(List.of("\"say \"\"hi\"\", ok\"")),
                ValueExpressions.arguments("New Thing(\"say \"\"hi\"\", ok\")"));
    }

    @Test
    void testArgumentsWithoutList() {
        assertEquals(Optional.empty(), ValueExpressions.arguments("System.Drawing.Color.Red"));
        assertEquals(Optional.empty(), ValueExpressions.arguments("\"(not an argument list)\""));
        assertEquals(Optional.empty(), ValueExpressions.arguments("new Size(1, 2"));
        assertEquals(Optional.of(List.of()), ValueExpressions.arguments("new Padding()"));
    }

    @Test
    void testIntPair() {
        assertEquals(Optional.of(new IntPair(12, 70)), ValueExpressions.intPair("New System.Drawing.Point(12, 70)"));
        assertEquals(Optional.of(new IntPair(-4, 0)), ValueExpressions.intPair("new Point( -4 ,0 )"));
        assertEquals(Optional.empty(), ValueExpressions.intPair("new SizeF(7F, 15F)"));
        assertEquals(Optional.empty(), ValueExpressions.intPair("new Padding(3)"));
    }

    @Test
    void testIntArgumentAndParseInt() {
        assertEquals(OptionalInt.of(3), ValueExpressions.intArgument("new Padding(1, 2, 3, 4)", 2));
        assertEquals(OptionalInt.empty(), ValueExpressions.intArgument("new Padding(1, 2, 3, 4)", 4));
        assertEquals(OptionalInt.of(7), ValueExpressions.parseInt(" 7 "));
        assertEquals(OptionalInt.empty(), ValueExpressions.parseInt("7.5"));
    }

    @Test
    void testIsStringLiteral() {
        assertTrue(ValueExpressions.isStringLiteral("\"OK\""));
        assertTrue(ValueExpressions.isStringLiteral("@\"C:\\temp\""));
        assertTrue(ValueExpressions.isStringLiteral("\"\""));
        assertFalse(ValueExpressions.isStringLiteral("\""));
        assertFalse(ValueExpressions.isStringLiteral("resources.GetString(\"x\")"));
    }

    @Test
    void testUnquoteCSharp() {
        assertEquals(Optional.of("Line1\nTab\t\"q\"\\"),
                ValueExpressions.unquote("\"Line1\\nTab\\t\\\"q\\\"\\\\\"", Dialect.CSHARP));
        assertEquals(Optional.of("C:\\temp\\\"x\""),
                ValueExpressions.unquote("@\"C:\\temp\\\"\"x\"\"\"", Dialect.CSHARP));
        assertEquals(Optional.empty(), ValueExpressions.unquote("true", Dialect.CSHARP));
    }

    @Test
    void testUnquoteVisualBasic() {
        assertEquals(Optional.of("say \"hi\""), ValueExpressions.unquote("\"say \"\"hi\"\"\"", Dialect.VISUAL_BASIC));
        assertEquals(Optional.of("C:\\new"), ValueExpressions.unquote("\"C:\\new\"", Dialect.VISUAL_BASIC));
    }
}
