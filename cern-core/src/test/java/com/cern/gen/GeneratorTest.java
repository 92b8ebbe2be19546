package com.cern.gen;

import com.cern.GenerationException;
import com.cern.Parser;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class GeneratorTest {

    private static String generate(String source) {
        return new Generator(Parser.parse(source)).generateProgram();
    }

    @Test
    void testEmptyProgram() {
        assertEquals("""
            #include <cstdlib>

            int main()
            {
                return EXIT_SUCCESS;
            }
            """, generate(""));
    }

    @Test
    void testStatements() {
        String source = String.join("\n",
            "var x = 1",
            "x = x + 2 * 3",
            "return x");
        assertEquals("""
            #include <cstdlib>

            int main()
            {
                int x = 1;
                x = x + 2 * 3;
                return x;
                return EXIT_SUCCESS;
            }
            """, generate(source));
    }

    @Test
    void testDeclaredTypes() {
        String output = generate("var i = (1 + 2) * 3\nvar c = 'k'\nvar a = i");
        assertTrue(output.contains("    int i = (1 + 2) * 3;\n"), output);
        assertTrue(output.contains("    char c = 'k';\n"), output);
        assertTrue(output.contains("    auto a = i;\n"), output);
    }

    @Test
    void testIfChain() {
        String source = "var x = 1\nif (x) { x = 2 } elif (x - 1) { x = 3 } else { var y = 'c' }";
        assertEquals("""
            #include <cstdlib>

            int main()
            {
                int x = 1;
                if (x)
                {
                    x = 2;
                }
                else if (x - 1)
                {
                    x = 3;
                }
                else
                {
                    char y = 'c';
                }
                return EXIT_SUCCESS;
            }
            """, generate(source));
    }

    @Test
    void testNestedScope() {
        assertEquals("""
            #include <cstdlib>

            int main()
            {
                {
                    int x = 1;
                }
                return EXIT_SUCCESS;
            }
            """, generate("{ var x = 1 }"));
    }

    @Test
    void testUndeclaredIdentifier() {
        GenerationException e = assertThrows(GenerationException.class, () -> generate("var x = 1\nreturn y + x"));
        assertEquals(2, e.getLine());
        assertEquals("[Generation Error] undeclared identifier `y` on line 2", e.getMessage());
    }

    @Test
    void testAssignmentToUndeclared() {
        assertEquals(1, assertThrows(GenerationException.class, () -> generate("x = 1")).getLine());
    }

    @Test
    void testRedeclarationInSameScope() {
        GenerationException e = assertThrows(GenerationException.class, () -> generate("var x = 1\nvar x = 2"));
        assertEquals("[Generation Error] identifier `x` already declared on line 2", e.getMessage());
    }

    @Test
    void testShadowingAndScopeExit() {
        assertDoesNotThrow(() -> generate("var x = 1\n{ var x = 'a' x = 'b' }\nx = 2"));
        assertThrows(GenerationException.class, () -> generate("{ var y = 1 }\nreturn y"));
    }

    @Test
    void testInitializerCannotReadItself() {
        assertThrows(GenerationException.class, () -> generate("var x = x + 1"));
    }
}
