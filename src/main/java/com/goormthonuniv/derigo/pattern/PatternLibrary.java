package com.goormthonuniv.derigo.pattern;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 본문 휴리스틱에 쓰는 어휘 패턴 표. 상태 없음.
 * 모든 정규식은 대소문자 무시로 컴파일한다.
 */
public final class PatternLibrary {

    private PatternLibrary() {}

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    private static Pattern p(String regex) {
        return Pattern.compile(regex, FLAGS);
    }

    // ===================== 신뢰도(진실성) 추정용 =====================

    /** 낚시성 문구(소문자 부분 일치) */
    public static final List<String> CLICKBAIT_PHRASES = List.of(
            "you won't believe",
            "shocking",
            "mind-blowing",
            "what happens next",
            "this will change",
            "secret revealed",
            "they don't want you to know",
            "share before deleted",
            "breaking:"
    );

    /** 선정적 어휘(소문자 부분 일치, 종류 수로 집계) */
    public static final List<String> SENSATIONAL_WORDS = List.of(
            "outrage", "disgusting", "horrific", "amazing", "incredible",
            "terrifying", "explosive", "bombshell", "slammed", "destroyed"
    );

    /** 인용/출처 표기(소문자 부분 일치). 인라인 링크(http)도 포함 */
    public static final List<String> CITATION_PHRASES = List.of(
            "according to",
            "reported by",
            "study shows",
            "research indicates",
            "data from",
            "http",
            "source:"
    );

    /** 수치/통계: 퍼센트, 소수, 금액, 4자리 연도 */
    public static final Pattern STATISTIC = Pattern.compile("\\d+%|\\d+\\.\\d+|\\$\\d+|\\d{4}");

    /** 20자 이상 직접 인용 */
    public static final Pattern LONG_QUOTE = Pattern.compile("\"[^\"]{20,}\"|“[^”]{20,}”");

    // ===================== 작성자 신호용 =====================

    /** 감정/선동 어휘(단어 단위 일치) */
    public static final Set<String> EMOTIONAL_WORDS = Set.of(
            "outrage", "disgusting", "horrific", "unbelievable", "shocking",
            "pathetic", "idiotic", "insane", "radical", "extremist",
            "destroy", "attack", "enemy", "traitor", "corrupt", "evil",
            "terrible", "awful", "horrible", "despicable", "vile"
    );

    public static final List<Pattern> PERSONAL_ATTACKS = List.of(
            p("you('re| are) (an? )?(idiot|moron|stupid|dumb)"),
            p("people like you"),
            p("wake up,? (sheeple|sheep)"),
            p("(libtard|conservatard|snowflake|cuck|shill)"),
            p("go back to"),
            p("typical (liberal|conservative|leftist|rightist)"),
            p("you (must|probably) (work for|be paid by)")
    );

    public static final List<Pattern> BAD_FAITH = List.of(
            p("what about"),
            p("so you('re)? saying"),
            p("typical \\w+ response"),
            p("you (probably|must) (think|believe)"),
            p("nice try,? but"),
            p("that's rich coming from")
    );

    public static final List<Pattern> ENGAGEMENT_BAIT = List.of(
            p("change my mind"),
            p("fight me"),
            p("prove me wrong"),
            p("bet you (can't|won't)"),
            p("i dare (you|anyone)"),
            p("unpopular opinion:?"),
            p("hot take:?"),
            p("controversial:?")
    );

    public static final List<Pattern> PROMOTIONAL = List.of(
            p("buy now"),
            p("limited time"),
            p("click (here|the link)"),
            p("check out"),
            p("don't miss"),
            p("exclusive offer"),
            p("use code"),
            p("sign up"),
            p("subscribe"),
            p("free trial")
    );

    /** 자리표시자 템플릿: [name], {{...}}, %TOKEN%, INSERT ... HERE, {your...} */
    public static final List<Pattern> TEMPLATE_MARKERS = List.of(
            p("\\[name\\]|\\[company\\]|\\[product\\]"),
            Pattern.compile("\\{\\{.*?\\}\\}"),
            Pattern.compile("%[A-Z_]+%"),
            p("INSERT .* HERE"),
            p("\\{your.*?\\}")
    );

    /** 추적 파라미터와 단축 URL */
    public static final List<Pattern> AFFILIATE_MARKERS = List.of(
            p("\\?ref="),
            p("\\?aff="),
            p("\\?tag="),
            p("affiliate"),
            p("amzn\\.to"),
            p("bit\\.ly"),
            p("tinyurl"),
            p("linktr\\.ee")
    );

    public static final List<Pattern> WHATABOUTISM = List.of(
            p("what about"),
            p("but (what|how) about"),
            p("yeah,? but"),
            p("but they (also|did)")
    );

    // ----- 개인 목소리 (각 항목 가산점) -----
    public static final Pattern REFLECTIVE_FIRST_PERSON = p("\\bi\\s+(think|believe|feel|wonder|guess)");
    public static final Pattern OWN_PERSPECTIVE = p("\\bmy (experience|opinion|view|take)");
    public static final Pattern HEDGING = p("\\b(maybe|perhaps|might|could be|seems like)");
    public static final Pattern UNCERTAINTY = p("\\b(i'm not sure|i could be wrong|correct me if)");
    public static final Pattern FIRST_PERSON_STORY = p("\\bi (was|went|saw|heard|met|talked)");

    // ----- 뉘앙스 (각 항목 가산점) -----
    public static final Pattern OTHER_VIEWPOINTS = p("\\b(on the other hand|however|although|while|granted)");
    public static final Pattern CONDITIONALS = p("\\b(it depends|in some cases|under certain)");
    public static final Pattern COMPLEXITY = p("\\b(complex|nuanced|complicated|multifaceted)");
    public static final Pattern REFERENCES = p("\\b(according to|research shows|studies indicate|data suggests)");
    /** 물음표 두 개 사이 구간(연속 질문). 단발 질문은 세지 않는다 */
    public static final Pattern QUESTION = Pattern.compile("\\?[^?!]*\\?");
    public static final Pattern RHETORICAL_QUESTION = p("\\b(seriously|really|honestly)\\?");
    public static final Pattern LIMITATIONS = p("\\b(i (don't|can't) (know|say) for sure|more research|not an expert)");
}
