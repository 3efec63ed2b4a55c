package com.insightplatform.common.calendar;

import com.insightplatform.common.text.QueryNormalizer;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Fixed table of recurring wine and beverage commerce occasions for an Israeli
 * storefront. Keywords are Hebrew and English and are normalized on load so that
 * matching against {@link QueryNormalizer} output is a plain substring test.
 */
public final class CalendarEvents {

    public static final List<CalendarEvent> ALL = List.of(
        event("Valentine's Day", "ולנטיין", Set.of(2),
            "Create a Valentine's wine bundle: rosé and champagne gift sets",
            "רוזה", "rosé", "rose", "רוזא", "שמפניה", "champagne",
            "מתנה", "gift", "רומנטי", "romantic", "זוגי", "couple",
            "פרוסקו", "prosecco", "בועות", "bubbles"),
        event("Purim", "פורים", Set.of(3),
            "Push gift packages, spirits and party bundles for Purim",
            "יין", "משלוח מנות", "משקה", "ויסקי", "וויסקי", "whisky", "whiskey",
            "וודקה", "vodka", "ליקר", "liqueur", "מסיבה", "party",
            "מתנה", "gift", "ארוז", "package"),
        event("Pesach", "פסח", Set.of(3, 4),
            "Highlight kosher-for-Pesach wines and Seder wine recommendations",
            "כשר לפסח", "kosher", "פסח", "pesach", "passover",
            "יין אדום", "red wine", "הגדה", "seder",
            "מצה", "ארבע כוסות", "four cups"),
        event("Summer BBQ Season", "קיץ ומנגל", Set.of(6, 7, 8),
            "Feature chilled rosés, light whites and BBQ-pairing reds",
            "רוזה", "rosé", "rose", "בירה", "beer", "קל", "light",
            "מנגל", "bbq", "grill", "קיץ", "summer",
            "לבן", "white", "קר", "cold", "מרענן", "refreshing",
            "סנגריה", "sangria", "ספריץ", "spritz", "אפרול", "aperol"),
        event("Tu B'Av", "טו באב", Set.of(7, 8),
            "Promote romantic wine experiences with rosé and sparkling for Tu B'Av",
            "רוזה", "rosé", "rose", "רומנטי", "romantic",
            "שמפניה", "champagne", "בועות", "bubbles",
            "פרוסקו", "prosecco", "אהבה", "love"),
        event("Rosh Hashana", "ראש השנה", Set.of(9, 10),
            "Push premium wines, sweet wines and holiday gift sets for Rosh Hashana",
            "יין מתוק", "sweet wine", "ראש השנה", "rosh hashana",
            "חג", "holiday", "פרימיום", "premium",
            "יקב", "winery", "מתנה", "gift",
            "יין אדום", "red wine", "קידוש", "kiddush"),
        event("Sukkot", "סוכות", Set.of(10),
            "Continue holiday wine promotions through Sukkot",
            "חג", "holiday", "סוכות", "sukkot",
            "יין", "wine", "קידוש", "kiddush",
            "שמחת תורה", "simchat"),
        event("Christmas & New Year", "חג המולד וסילבסטר", Set.of(12, 1),
            "Feature champagne, sparkling wines and premium spirits for New Year celebrations",
            "שמפניה", "champagne", "בועות", "bubbles",
            "פרוסקו", "prosecco", "סילבסטר", "new year",
            "christmas", "חג המולד", "מתנה", "gift",
            "ויסקי", "וויסקי", "whisky", "whiskey",
            "קאווה", "cava")
    );

    private CalendarEvents() {}

    /**
     * Events whose keyword list contains a substring of {@code normalizedQuery},
     * in table order. Several events may match one query.
     */
    public static List<CalendarEvent> match(String normalizedQuery) {
        List<CalendarEvent> matches = new ArrayList<>();
        if (normalizedQuery == null || normalizedQuery.isEmpty()) {
            return matches;
        }
        for (CalendarEvent event : ALL) {
            if (event.keywords().stream().anyMatch(normalizedQuery::contains)) {
                matches.add(event);
            }
        }
        return matches;
    }

    private static CalendarEvent event(String name, String localName, Set<Integer> months,
                                       String campaignHint, String... keywords) {
        List<String> normalized = Stream.of(keywords)
            .map(QueryNormalizer::normalize)
            .filter(k -> !k.isEmpty())
            .distinct()
            .collect(Collectors.toUnmodifiableList());
        return new CalendarEvent(name, localName, months, normalized, campaignHint);
    }
}
