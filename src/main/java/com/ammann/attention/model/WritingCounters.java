/* (C)2026 */
package com.ammann.attention.model;

import com.ammann.attention.dto.WritingProgressDTO;
import jakarta.persistence.Column;
import jakarta.persistence.MappedSuperclass;
import java.time.Instant;

/**
 * Writing-specific counters shared by the hourly and daily writing rollups.
 */
@MappedSuperclass
public abstract class WritingCounters extends StreamRollup {

    @Column(nullable = false)
    public long keystrokes;

    @Column(name = "words_added", nullable = false)
    public long wordsAdded;

    @Column(name = "words_deleted", nullable = false)
    public long wordsDeleted;

    @Column(name = "net_words", nullable = false)
    public long netWords;

    public void accumulate(WritingProgressDTO delta, Instant at) {
        accumulate(delta.activeSeconds(), delta.focusedSeconds(), at);
        this.keystrokes += delta.keystrokes();
        this.wordsAdded += delta.wordsAdded();
        this.wordsDeleted += delta.wordsDeleted();
        this.netWords += delta.netWords();
    }
}
