package io.github.huiyu.imgsort.mutation;

import io.github.huiyu.imgsort.image.ImageIdentity;

import org.junit.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;

import static org.junit.Assert.*;

public class UndoStackTest {

    private static UndoRecord record(String name) {
        ImageIdentity identity = ImageIdentity.of(Paths.get("/pictures", name));
        Path destination = Paths.get("/pictures/deleted", name);
        return new UndoRecord(identity, destination, null,
                Collections.singletonMap(identity.getPath(), destination), 0L);
    }

    @Test
    public void testLastInFirstOut() {
        UndoStack stack = new UndoStack(5);
        UndoRecord first = record("a.jpg");
        UndoRecord second = record("b.jpg");
        stack.push(first);
        stack.push(second);
        assertSame(second, stack.peek());
        assertSame(second, stack.pop());
        assertSame(first, stack.pop());
        assertNull(stack.pop());
    }

    @Test
    public void testOverflowDropsOldest() {
        UndoStack stack = new UndoStack(2);
        UndoRecord a = record("a.jpg");
        UndoRecord b = record("b.jpg");
        UndoRecord c = record("c.jpg");
        stack.push(a);
        stack.push(b);
        stack.push(c);
        assertEquals(2, stack.size());
        assertSame(c, stack.pop());
        assertSame(b, stack.pop());
        assertNull(stack.pop());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testCapacityMustBePositive() {
        new UndoStack(0);
    }
}
