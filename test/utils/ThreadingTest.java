package utils;

import java.io.IOException;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import junit.framework.TestCase;

public class ThreadingTest extends TestCase {

    public void testResultsKeepInputOrder() throws IOException {
        List<String> items = Arrays.asList("a", "b", "c", "d", "e");

        List<String> results = Threading.mapInOrder(items, String::toUpperCase, 3);

        assertEquals(Arrays.asList("A", "B", "C", "D", "E"), results);
    }

    public void testSingleThreadRunsSequentially() throws IOException {
        List<Integer> results = Threading.mapInOrder(Arrays.asList("x", "yy"), String::length, 1);
        assertEquals(Arrays.asList(1, 2), results);
    }

    public void testEmptyInputGivesEmptyResult() throws IOException {
        assertTrue(Threading.mapInOrder(Collections.<String>emptyList(), String::length, 4).isEmpty());
    }

    public void testWorkerErrorIsRethrown() throws IOException {
        try {
            Threading.mapInOrder(Arrays.asList("a", "b"), x -> {
                if (x.equals("b")) {
                    throw new StackOverflowError();
                }
                return x;
            }, 2);
            fail("Expected StackOverflowError");
        } catch (StackOverflowError expected) {
            // worker failure reached the caller
        }
    }

    public void testWorkerIOExceptionIsRethrown() {
        try {
            Threading.mapInOrder(Arrays.asList("a", "b", "c"), x -> {
                if (x.equals("c")) {
                    throw new IOException("cannot read " + x);
                }
                return x;
            }, 2);
            fail("Expected IOException");
        } catch (IOException expected) {
            assertEquals("cannot read c", expected.getMessage());
        }
    }

    public void testWorkerRuntimeExceptionIsRethrown() throws IOException {
        try {
            Threading.mapInOrder(Arrays.asList("a", "b"), x -> {
                throw new IllegalStateException("bad " + x);
            }, 2);
            fail("Expected IllegalStateException");
        } catch (IllegalStateException expected) {
            assertTrue(expected.getMessage().startsWith("bad "));
        }
    }
}
