package com.sashkomusic.catalogreconciler.domain.port;

import com.sashkomusic.catalogreconciler.domain.model.MergedTagSet;

import java.nio.file.Path;

public interface TagWriterPort {

    /**
     * @param artwork cover image to embed, or {@code null} to leave the current one
     * @throws com.sashkomusic.catalogreconciler.domain.exception.TagWriteException on any failure
     */
    void writeTags(Path audioFile, MergedTagSet tags, byte[] artwork);
}
