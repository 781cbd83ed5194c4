package org.stackfall.replay.codec;

import org.stackfall.replay.ReplayData;

/**
 * Converts replays to and from their persisted byte form.
 */
public interface IReplayCodec {

    byte[] encode(ReplayData data) throws ReplayCodecException;

    ReplayData decode(byte[] bytes) throws ReplayCodecException;
}
