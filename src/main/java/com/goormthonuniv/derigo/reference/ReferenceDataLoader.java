package com.goormthonuniv.derigo.reference;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.goormthonuniv.derigo.domain.Axis;
import com.goormthonuniv.derigo.domain.AuthorIntent;
import com.goormthonuniv.derigo.domain.BiasRating;
import com.goormthonuniv.derigo.domain.KeywordEntry;
import com.goormthonuniv.derigo.domain.KnownActorEntry;
import com.goormthonuniv.derigo.domain.SourceEntry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;

/**
 * JSON 배열 형태의 참조 표(키워드/출처/알려진 계정)를 읽는다.
 * - 형식이 잘못된 항목은 건너뛰고 경고만 남긴다(치명적 오류 아님)
 * - 리소스 자체를 읽지 못하면 빈 목록을 돌려준다
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReferenceDataLoader {

    private final ObjectMapper objectMapper;

    public List<KeywordEntry> loadKeywords(Resource resource) {
        return load(resource, "keyword", this::toKeyword);
    }

    public List<SourceEntry> loadSources(Resource resource) {
        return load(resource, "source", this::toSource);
    }

    public List<KnownActorEntry> loadKnownActors(Resource resource) {
        return load(resource, "known-actor", this::toKnownActor);
    }

    // ===================== 공통 =====================

    private <T> List<T> load(Resource resource, String kind, Function<JsonNode, Optional<T>> mapper) {
        JsonNode root;
        try (InputStream in = resource.getInputStream()) {
            root = objectMapper.readTree(in);
        } catch (IOException e) {
            log.error("[Derigo] {} table unreadable: {} ({})", kind, resource.getDescription(), e.getMessage());
            return List.of();
        }
        if (root == null || !root.isArray()) {
            log.error("[Derigo] {} table is not a JSON array: {}", kind, resource.getDescription());
            return List.of();
        }

        List<T> out = new ArrayList<>();
        int skipped = 0;
        for (JsonNode node : root) {
            Optional<T> entry = mapper.apply(node);
            if (entry.isPresent()) {
                out.add(entry.get());
            } else {
                skipped++;
                log.warn("[Derigo] skipped malformed {} entry: {}", kind, node);
            }
        }
        log.info("[Derigo] loaded {} {} entries ({} skipped) from {}", out.size(), kind, skipped, resource.getDescription());
        return out;
    }

    // ===================== 키워드 =====================

    Optional<KeywordEntry> toKeyword(JsonNode n) {
        String term = text(n, "term");
        Axis axis = Axis.fromKey(text(n, "axis"));
        if (term == null || axis == null) return Optional.empty();

        JsonNode dir = n.get("direction");
        if (dir == null || !dir.isIntegralNumber()) return Optional.empty();
        int direction = dir.asInt();
        if (direction != -1 && direction != 1) return Optional.empty();

        JsonNode w = n.get("weight");
        if (w == null || !w.isNumber()) return Optional.empty();
        double weight = w.asDouble();
        if (weight < 1 || weight > 10) return Optional.empty();

        List<String> context = new ArrayList<>();
        JsonNode ctx = n.get("context");
        if (ctx != null && !ctx.isNull()) {
            if (!ctx.isArray()) return Optional.empty();
            for (JsonNode c : ctx) {
                if (c.isTextual() && !c.asText().isBlank()) context.add(c.asText().toLowerCase(Locale.ROOT));
            }
        }
        return Optional.of(new KeywordEntry(term.toLowerCase(Locale.ROOT), axis, direction, weight, context));
    }

    // ===================== 출처 =====================

    Optional<SourceEntry> toSource(JsonNode n) {
        String domain = text(n, "domain");
        if (domain == null) return Optional.empty();

        JsonNode fr = n.get("factualRating");
        if (fr == null || !fr.isNumber()) return Optional.empty();
        int factual = fr.asInt();
        if (factual < 0 || factual > 100) return Optional.empty();

        JsonNode bias = n.get("biasRating");
        if (bias == null || !bias.isObject()) return Optional.empty();
        Integer[] axes = new Integer[4];
        Axis[] order = Axis.values();
        for (int i = 0; i < order.length; i++) {
            JsonNode v = bias.get(order[i].key());
            if (v == null || !v.isNumber()) return Optional.empty();
            int value = v.asInt();
            if (value < -100 || value > 100) return Optional.empty();
            axes[i] = value;
        }

        String category = Optional.ofNullable(text(n, "category")).orElse("unknown");
        return Optional.of(new SourceEntry(
                domain.toLowerCase(Locale.ROOT),
                text(n, "name"),
                factual,
                new BiasRating(axes[0], axes[1], axes[2], axes[3]),
                category,
                text(n, "country")
        ));
    }

    // ===================== 알려진 계정 =====================

    Optional<KnownActorEntry> toKnownActor(JsonNode n) {
        String identifier = text(n, "identifier");
        String platform = text(n, "platform");
        if (identifier == null || platform == null) return Optional.empty();

        AuthorIntent category;
        try {
            category = AuthorIntent.fromKey(text(n, "category"));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
        if (category == null) return Optional.empty();

        JsonNode c = n.get("confidence");
        if (c == null || !c.isNumber()) return Optional.empty();
        double confidence = c.asDouble();
        if (confidence < 0 || confidence > 1) return Optional.empty();

        LocalDate added = null;
        String addedText = text(n, "addedDate");
        if (addedText != null) {
            try {
                added = LocalDate.parse(addedText.length() > 10 ? addedText.substring(0, 10) : addedText);
            } catch (DateTimeParseException e) {
                return Optional.empty();
            }
        }

        return Optional.of(new KnownActorEntry(
                identifier.toLowerCase(Locale.ROOT),
                platform.toLowerCase(Locale.ROOT),
                category,
                confidence,
                text(n, "source"),
                added,
                text(n, "attribution")
        ));
    }

    private static String text(JsonNode n, String field) {
        JsonNode v = n == null ? null : n.get(field);
        if (v == null || !v.isTextual() || v.asText().isBlank()) return null;
        return v.asText().trim();
    }
}
