package com.goormthonuniv.derigo.reference;

import com.goormthonuniv.derigo.domain.BiasRating;
import com.goormthonuniv.derigo.domain.SourceEntry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SourceReputationPolicyTest {

    private final SourceReputationPolicy policy = new SourceReputationPolicy(List.of(
            new SourceEntry("reuters.com", "Reuters", 95, BiasRating.NEUTRAL, "news", null),
            new SourceEntry("www.special.org", "Special", 70, BiasRating.NEUTRAL, "news", null)
    ));

    @ParameterizedTest
    @CsvSource({
            "https://reuters.com/a, true",
            "https://www.reuters.com/a?b=c, true",
            "reuters.com, true",
            "www.reuters.com/path, true",
            "https://www.special.org, true",
            "https://uk.reuters.com, false",
            "https://notreuters.com, false"
    })
    @DisplayName("정확한 host → www 제거 host 순으로 조회")
    void lookup(String url, boolean found) {
        assertThat(policy.lookup(url).isPresent()).isEqualTo(found);
    }

    @Test
    @DisplayName("host 추출은 포트/경로/질의를 떼고 소문자")
    void hostOf() {
        assertThat(SourceReputationPolicy.hostOf("HTTPS://WWW.Example.COM:8443/a?b#c")).isEqualTo("www.example.com");
        assertThat(SourceReputationPolicy.hostOf("")).isNull();
    }
}
