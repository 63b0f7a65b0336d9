package com.example.geotagger;

import com.example.geotagger.model.ItemRecord;

public record Classification(ItemRecord record, Disposition disposition, String reason) {
}
