package com.sashkomusic.catalogreconciler.domain.model;

/**
 * Pipeline variants. All of them share the search and scoring phase; they differ in which merged
 * fields reach the file and the store, and in whether search stops to wait for a user choice.
 */
public enum ReconciliationMode {

    AUTOMATIC {
        @Override
        public MergedTagSet project(MergedTagSet merged) {
            return merged;
        }
    },

    ARTWORK_ONLY {
        @Override
        public MergedTagSet project(MergedTagSet merged) {
            return merged.artworkOnly();
        }

        @Override
        public boolean requiresArtwork() {
            return true;
        }
    },

    MANUAL {
        @Override
        public MergedTagSet project(MergedTagSet merged) {
            return merged;
        }

        @Override
        public boolean stopsForSelection() {
            return true;
        }
    };

    public abstract MergedTagSet project(MergedTagSet merged);

    public boolean stopsForSelection() {
        return false;
    }

    public boolean requiresArtwork() {
        return false;
    }
}
