package com.scholary.oralhistory.captions;

/** A transcript offset paired with the playback time it is reached at. */
public record TimingSyncPair(int offset, int timeMs) {}
