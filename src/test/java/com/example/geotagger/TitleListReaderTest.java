package com.example.geotagger;

import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class TitleListReaderTest {

    @Test
    void readsTitleColumnFromCsv() throws Exception {
        Path dir = Files.createTempDirectory("titles-test");
        Path csv = Files.writeString(dir.resolve("titles.csv"),
                "note,title\nfirst,File:Louvre.jpg\nempty,\nthird, Orsay.jpg \n");

        assertEquals(List.of("File:Louvre.jpg", "Orsay.jpg"), new TitleListReader().read(csv));
    }

    @Test
    void readsOneTitlePerLine() throws Exception {
        Path dir = Files.createTempDirectory("titles-test");
        Path text = Files.writeString(dir.resolve("titles.txt"), "File:Louvre.jpg\n\n  Orsay.jpg\n");

        assertEquals(List.of("File:Louvre.jpg", "Orsay.jpg"), new TitleListReader().read(text));
    }
}
