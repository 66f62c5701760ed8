package com.sashkomusic.catalogreconciler.domain.model;

import java.util.List;

public record CandidateSearchResult(
        List<TrackCandidateSet> tracks,
        int total,
        int withCandidates,
        int withoutCandidates
) {

    public static CandidateSearchResult of(List<TrackCandidateSet> tracks) {
        List<TrackCandidateSet> copy = List.copyOf(tracks);
        int with = (int) copy.stream().filter(TrackCandidateSet::hasCandidates).count();
        return new CandidateSearchResult(copy, copy.size(), with, copy.size() - with);
    }
}
