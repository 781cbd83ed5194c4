package org.stackfall.testutils;

import org.stackfall.input.IKeySource;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Key source fed from bursts of bytes. Bytes of one burst are available together; the next
 * burst becomes available after the reader sleeps. Sleeps are recorded instead of performed.
 */
public final class ScriptedKeySource implements IKeySource {

    private final Deque<Deque<Integer>> bursts = new ArrayDeque<>();
    private final List<Long> sleeps = new ArrayList<>();
    private IOException failure;

    public static ScriptedKeySource of(String... bursts) {
        ScriptedKeySource source = new ScriptedKeySource();
        for (String burst : bursts) {
            source.burst(burst);
        }
        return source;
    }

    public synchronized ScriptedKeySource burst(String chars) {
        Deque<Integer> bytes = new ArrayDeque<>();
        chars.chars().forEach(bytes::add);
        bursts.addLast(bytes);
        return this;
    }

    /**
     * Makes every read and availability check fail once the scripted bytes are used up.
     */
    public synchronized ScriptedKeySource failWhenExhausted(IOException e) {
        this.failure = e;
        return this;
    }

    @Override
    public synchronized boolean available() throws IOException {
        Deque<Integer> current = bursts.peekFirst();
        if (current != null && !current.isEmpty()) {
            return true;
        }
        if (failure != null && bursts.stream().allMatch(Deque::isEmpty)) {
            throw failure;
        }
        return false;
    }

    @Override
    public synchronized int read() throws IOException {
        Deque<Integer> current = bursts.peekFirst();
        if (current == null || current.isEmpty()) {
            if (failure != null) {
                throw failure;
            }
            return -1;
        }
        return current.pollFirst();
    }

    @Override
    public synchronized void sleep(long millis) {
        sleeps.add(millis);
        Deque<Integer> current = bursts.peekFirst();
        if (current != null && current.isEmpty()) {
            bursts.pollFirst();
        }
    }

    public synchronized List<Long> sleeps() {
        return List.copyOf(sleeps);
    }
}
