package edu.sunyk.containers.interaction;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import org.junit.jupiter.api.Test;

public class ScriptRunnerTest {

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);

    private static String resource(String name) throws Exception {
        return Paths.get(ScriptRunnerTest.class.getResource("/scripts/" + name).toURI()).toString();
    }

    private String output() {
        return new String(buffer.toByteArray(), StandardCharsets.UTF_8);
    }

    @Test
    public void testRunsScript() throws Exception {
        assertEquals(ScriptRunner.OK, ScriptRunner.run(new String[] {resource("basic.csv")}, out));
        assertTrue(output().contains("delete 8 -> 8=eight"), output());
        assertTrue(output().contains("Done: 13 operations, size 6"), output());
    }

    @Test
    public void testRenderFlagPrintsTreeAfterMutations() throws Exception {
        assertEquals(ScriptRunner.OK, ScriptRunner.run(new String[] {resource("basic.csv"), "--render"}, out));
        assertTrue(output().contains("2B:Root"), output());
    }

    @Test
    public void testDuplicatePolicyFlag() throws Exception {
        assertEquals(ScriptRunner.OK, ScriptRunner.run(new String[] {resource("duplicates.csv")}, out));
        assertTrue(output().contains("inorder [5, 5]"), output());

        buffer.reset();
        assertEquals(ScriptRunner.OK, ScriptRunner.run(new String[] {resource("duplicates.csv"), "--replace"}, out));
        assertTrue(output().contains("insert 5=second (replaced first)"), output());
        assertTrue(output().contains("find 5 -> second"), output());
        assertTrue(output().contains("inorder [5]"), output());
    }

    @Test
    public void testUsageErrors() {
        assertEquals(ScriptRunner.BAD_INPUT, ScriptRunner.run(new String[0], out));
        assertTrue(output().startsWith("Usage"), output());
        assertEquals(ScriptRunner.BAD_INPUT, ScriptRunner.run(new String[] {"a.csv", "--fast"}, out));
    }

    @Test
    public void testUnreadableScript() throws Exception {
        assertEquals(ScriptRunner.BAD_INPUT, ScriptRunner.run(new String[] {"no/such/script.csv"}, out));
        assertEquals(ScriptRunner.BAD_INPUT, ScriptRunner.run(new String[] {resource("bad_key.csv")}, out));
        assertTrue(output().contains("line 2"), output());
    }
}
