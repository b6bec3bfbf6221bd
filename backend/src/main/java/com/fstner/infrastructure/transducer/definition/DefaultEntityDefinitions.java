package com.fstner.infrastructure.transducer.definition;

import com.fstner.domain.recognition.model.EntityCategory;

import java.util.ArrayList;
import java.util.List;

import static com.fstner.domain.recognition.model.EntityCategory.*;
import static com.fstner.infrastructure.transducer.definition.TransitionDefinition.continuation;

/**
 * Built-in definition set covering persons, postal codes, cities, addresses, prices,
 * emails, dates, phone numbers, URLs and numbers.
 *
 * <p>Transitions leaving {@value #INITIAL_STATE} are ordered by priority: single-token
 * entities with distinctive shapes first, then the openings of multi-token entities.</p>
 */
public final class DefaultEntityDefinitions {

    public static final String NAME = "default";
    public static final String INITIAL_STATE = "q0";

    private static final String CAPITALIZED_WORD = "\\p{Lu}\\p{Ll}+(?:-\\p{Lu}?\\p{Ll}+)*";
    private static final String DECIMAL = "\\d+(?:[.,]\\d+)?";
    private static final String CURRENCY_WORD =
            "(?i)(?:forint|ft|huf|eur|euros?|usd|dollars?|yen|pounds?|gbp)";
    private static final String UNIT_WORD =
            "(?i)(?:db|darab|kg|g|km|m|cm|mm|l|perc|óra|nap|hét|hónap|év|százalék|percent|pieces?|items?)";
    private static final String STREET_TYPE =
            "(?i)(?:utca|u|út|útja|tér|tere|körút|krt|sugárút|köz|sor|fasor|rakpart|street|st|road|rd|avenue|ave)";

    private DefaultEntityDefinitions() {
    }

    public static EntityDefinitionSet create() {
        List<TransitionDefinition> t = new ArrayList<>();

        // Single-token entities
        t.add(labeled(INITIAL_STATE, "(?:\\+36|06)[-/]?\\d{1,2}[-/]?\\d{3}-?\\d{3,4}", "q_phone", PHONE_NUMBER));
        t.add(continuation(INITIAL_STATE, "\\+36|06", "q_phone_prefix"));
        t.add(labeled(INITIAL_STATE, "[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}", "q_email", EMAIL));
        t.add(labeled(INITIAL_STATE, "(?:https?://|www\\.)[A-Za-z0-9.-]+(?:/[A-Za-z0-9&%_./?=#~+-]*)?", "q_url", URL));
        t.add(labeled(INITIAL_STATE,
                "\\d{4}[.-]?\\d{2}[.-]?\\d{2}|\\d{2}[.-]?\\d{2}[.-]?\\d{4}|\\d{2}/\\d{2}/\\d{4}",
                "q_date", DATE));
        t.add(labeled(INITIAL_STATE, "H-\\d{4},?", "q_postalcode", POSTALCODE));
        t.add(labeled(INITIAL_STATE, DECIMAL + "(?:Ft|HUF|EUR|USD|GBP|€|\\$|£)|[$€£]" + DECIMAL, "q_price", PRICE));
        t.add(labeled(INITIAL_STATE, DECIMAL + "%", "q_number_done", NUMBER));

        // Openings of multi-token entities
        t.add(continuation(INITIAL_STATE, "\\d{4}", "q_code"));
        t.add(continuation(INITIAL_STATE, DECIMAL, "q_number"));
        t.add(continuation(INITIAL_STATE, CAPITALIZED_WORD, "q_person"));

        // +36 30 123 4567
        t.add(continuation("q_phone_prefix", "\\d{1,2}", "q_phone_area"));
        t.add(labeled("q_phone_area", "\\d{7}", "q_phone", PHONE_NUMBER));
        t.add(continuation("q_phone_area", "\\d{3}", "q_phone_local"));
        t.add(labeled("q_phone_local", "\\d{3,4}", "q_phone", PHONE_NUMBER));

        // 2500 forint, 3,5 kg
        t.add(labeled("q_number", CURRENCY_WORD, "q_price", PRICE));
        t.add(labeled("q_number", UNIT_WORD, "q_number_done", NUMBER));

        // A four-digit code is a postal code when a settlement follows, a number otherwise
        t.add(labeled("q_code", CURRENCY_WORD, "q_price", PRICE));
        t.add(labeled("q_code", UNIT_WORD, "q_number_done", NUMBER));
        t.add(labeled("q_code", CAPITALIZED_WORD, "q_city", CITY));
        t.add(continuation("q_code", CAPITALIZED_WORD + ",", "q_street_start"));

        // 1051 Budapest, Kossuth Lajos utca 12
        t.add(continuation("q_street_start", "\\p{Lu}[\\p{L}-]*", "q_street"));
        t.add(continuation("q_street", STREET_TYPE, "q_street_type"));
        t.add(continuation("q_street", "\\p{Lu}[\\p{L}-]*", "q_street"));
        t.add(labeled("q_street_type", "\\d+(?:[/-]\\d+)?(?:/?[A-Za-z])?", "q_address", ADDRESS));

        // Kovács János
        t.add(labeled("q_person", CAPITALIZED_WORD, "q_person_done", PERSON));

        return new EntityDefinitionSet(NAME, INITIAL_STATE, List.of(
                INITIAL_STATE,
                "q_phone_prefix", "q_phone_area", "q_phone_local", "q_phone",
                "q_email",
                "q_url",
                "q_date",
                "q_postalcode",
                "q_code", "q_city", "q_street_start", "q_street", "q_street_type", "q_address",
                "q_number", "q_number_done", "q_price",
                "q_person", "q_person_done"
        ), t);
    }

    private static TransitionDefinition labeled(String from, String pattern, String to, EntityCategory category) {
        return TransitionDefinition.labeled(from, pattern, to, category.code());
    }
}
