package com.knowledgecore.vector;

import java.util.List;

import com.knowledgecore.ingest.KnowledgeItem;

/**
 * One page of a scroll. {@code nextOffset} is the store's opaque cursor and must be passed back verbatim;
 * {@code null} means the scroll is exhausted. An empty page with a cursor is valid.
 */
public record ScrollPage(List<KnowledgeItem> points, Object nextOffset) {

    public ScrollPage {
        points = points == null ? List.of() : List.copyOf(points);
    }
}
