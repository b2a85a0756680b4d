package com.goormthonuniv.derigo;

import com.goormthonuniv.derigo.domain.Axis;
import com.goormthonuniv.derigo.domain.BiasRating;
import com.goormthonuniv.derigo.domain.KeywordEntry;
import com.goormthonuniv.derigo.domain.SourceEntry;
import com.goormthonuniv.derigo.reference.KeywordTable;

import java.util.List;

/**
 * 테스트 공용 참조 데이터.
 */
public final class Fixtures {

    private Fixtures() {}

    public static KeywordTable keywords() {
        return new KeywordTable(List.of(
                new KeywordEntry("nationalize", Axis.ECONOMIC, -1, 8),
                new KeywordEntry("wealth tax", Axis.ECONOMIC, -1, 8),
                new KeywordEntry("deregulation", Axis.ECONOMIC, 1, 7),
                new KeywordEntry("tax cuts", Axis.ECONOMIC, 1, 7),
                new KeywordEntry("free enterprise", Axis.ECONOMIC, 1, 8),
                new KeywordEntry("union", Axis.ECONOMIC, -1, 3, List.of("workers", "strike")),
                new KeywordEntry("traditional values", Axis.SOCIAL, 1, 8),
                new KeywordEntry("civil liberties", Axis.AUTHORITY, -1, 7),
                new KeywordEntry("free trade", Axis.GLOBALISM, 1, 7)
        ));
    }

    public static SourceEntry reuters() {
        return new SourceEntry("reuters.com", "Reuters", 95,
                new BiasRating(0, 0, 0, 10), "news", "GB");
    }

    public static SourceEntry partisan() {
        return new SourceEntry("partisan.example", "Partisan", 40,
                new BiasRating(80, 60, 20, -50), "opinion", null);
    }
}
