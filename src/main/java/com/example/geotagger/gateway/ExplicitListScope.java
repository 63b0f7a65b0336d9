package com.example.geotagger.gateway;

import com.example.geotagger.model.RawEntry;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public record ExplicitListScope(List<String> ids) implements CrawlScope {
    public ExplicitListScope {
        Set<String> normalized = new LinkedHashSet<>();
        for (String id : ids) {
            if (id != null && !id.isBlank()) {
                normalized.add(RawEntry.ofTitle(id).id());
            }
        }
        ids = List.copyOf(normalized);
    }

    @Override
    public String describe() {
        return ids.size() + " listed files";
    }
}
