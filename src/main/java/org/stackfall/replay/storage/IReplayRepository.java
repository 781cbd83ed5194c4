package org.stackfall.replay.storage;

import org.stackfall.replay.ReplayData;

import java.io.IOException;
import java.util.List;

/**
 * Named storage for finished replays.
 * <p>
 * Names consist of letters, digits, {@code '-'}, {@code '_'} and {@code '.'}; anything else,
 * including path separators, is rejected with {@link IllegalArgumentException}.
 */
public interface IReplayRepository {

    /**
     * Stores a replay, replacing any replay with the same name.
     */
    void save(String name, ReplayData data) throws IOException;

    /**
     * @throws java.nio.file.NoSuchFileException if no replay with this name exists
     * @throws IOException if the replay cannot be read or decoded
     */
    ReplayData load(String name) throws IOException;

    /**
     * @return Names of all stored replays, sorted.
     */
    List<String> list() throws IOException;

    boolean exists(String name);

    /**
     * @return {@code true} if a replay was deleted.
     */
    boolean delete(String name) throws IOException;
}
