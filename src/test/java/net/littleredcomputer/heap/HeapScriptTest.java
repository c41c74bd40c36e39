package net.littleredcomputer.heap;

import org.junit.Test;

import static org.hamcrest.Matchers.*;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.fail;

public class HeapScriptTest {

    private static void assertRejected(String script, String fragment) {
        try {
            HeapScript.parseFrom(script);
            fail("expected IllegalArgumentException for: " + script);
        } catch (IllegalArgumentException e) {
            assertThat(e.getMessage(), containsString(fragment));
        }
    }

    @Test
    public void insertExtractScenario() {
        HeapScript s = HeapScript.parseFrom(
                "new 5\ninsert 3\ninsert 1\ninsert 4\ninsert 1\ninsert 5\n" +
                "top\nextract\nextract\nextract\nextract\nextract\nempty");
        assertThat(s.run(), contains("ok", "ok", "ok", "ok", "ok", "ok",
                "5", "5", "4", "3", "1", "1", "true"));
    }

    @Test
    public void everyCommand() {
        HeapScript s = HeapScript.parseFrom(String.join("\n",
                "# capacity five",
                "new 5",
                "insert 3", "insert 1", "insert 4", "insert 1", "insert 5",
                "full",
                "insert 9",
                "print",
                "",
                "find 1",
                "find 7",
                "change 3 10",
                "get 0",
                "remove 1",
                "print",
                "size",
                "clear",
                "empty",
                "extract",
                "remove 0"));
        assertThat(s.run(), contains(
                "ok", "ok", "ok", "ok", "ok", "ok",
                "true",
                "error: insert into full heap (capacity 5)",
                "5 4 3 1 1",
                "3",
                "-1",
                "0",
                "10",
                "5",
                "10 4 3 1 _",
                "4",
                "ok",
                "true",
                "error: extract from empty heap",
                "error: index (0) must be less than size (0)"));
    }

    @Test
    public void buildScenario() {
        HeapScript s = HeapScript.parseFrom("build 3 1 4 1 5\ntop\nsize\nfull\nprint");
        assertThat(s.run(), contains("ok", "5", "5", "true", "5 3 4 1 1"));
        assertThat(s.heap().capacity(), is(5));
    }

    @Test
    public void changePriorityScenario() {
        HeapScript s = HeapScript.parseFrom("build 1 2 3\nfind 1\nchange 2 10\ntop");
        assertThat(s.run(), contains("ok", "2", "0", "10"));
    }

    @Test
    public void errorsLeaveHeapUnchanged() {
        HeapScript s = HeapScript.parseFrom("new 2\ninsert 7\nremove 1\nchange -1 3\nprint\nsize");
        assertThat(s.run(), contains(
                "ok", "ok",
                "error: index (1) must be less than size (1)",
                "error: index (-1) must not be negative",
                "7 _",
                "1"));
    }

    @Test
    public void runStartsAfresh() {
        HeapScript s = HeapScript.parseFrom("new 3\ninsert 2\nsize");
        assertThat(s.run(), contains("ok", "ok", "1"));
        assertThat(s.run(), contains("ok", "ok", "1"));
    }

    @Test
    public void canonicalForm() {
        HeapScript s = HeapScript.parseFrom("  NEW   4\n#x\n\tinsert\t-2 \n\nChange 0 3");
        assertThat(s.toString(), is("new 4\ninsert -2\nchange 0 3"));
    }

    @Test
    public void syntaxErrors() {
        assertRejected("insert 3", "line 1: insert 3 before any new or build");
        assertRejected("new 3\nbogus 1", "line 2: unknown command: bogus");
        assertRejected("new 3\n\ninsert", "line 3: insert takes 1 argument(s), got 0");
        assertRejected("new 3\ninsert x", "line 2: not an integer: x");
        assertRejected("new 3\ntop 1", "line 2: top takes 0 argument(s), got 1");
    }

    @Test
    public void negativeCapacityIsRejectedBeforeRunning() {
        assertRejected("new 2\ninsert 1\nsize\nnew -1", "line 4: capacity must be non-negative: -1");
    }

    @Test
    public void unicodeBlankLinesAreSkipped() {
        HeapScript s = HeapScript.parseFrom("new 3\n\u00A0\n\u2003 \u00A0\ninsert\u00A01\n\u00A0# note\nsize");
        assertThat(s.toString(), is("new 3\ninsert 1\nsize"));
        assertThat(s.run(), contains("ok", "ok", "1"));
    }
}
