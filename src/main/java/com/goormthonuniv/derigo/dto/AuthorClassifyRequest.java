package com.goormthonuniv.derigo.dto;

import com.goormthonuniv.derigo.domain.ExtractedAuthor;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

public record AuthorClassifyRequest(
        @NotNull @Valid ExtractedAuthor author,
        String text                     // 작성자가 쓴 본문(없으면 빈 문자열)
) {}
