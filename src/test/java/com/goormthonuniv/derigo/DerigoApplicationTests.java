package com.goormthonuniv.derigo;

import com.goormthonuniv.derigo.domain.ExtractedAuthor;
import com.goormthonuniv.derigo.reference.ReferenceData;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class DerigoApplicationTests {

    @Autowired
    private ReferenceData referenceData;

    @Test
    @DisplayName("컨텍스트가 뜨고 번들 참조 표가 로드된다")
    void contextLoads() {
        assertThat(referenceData.keywords().size()).isGreaterThan(0);
        assertThat(referenceData.sources().lookup("https://www.reuters.com/world")).isPresent();
        assertThat(referenceData.knownActors().find(new ExtractedAuthor("spam_promo_bot", "twitter"))).isPresent();
    }
}
