package com.warpmap.parse;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * CamelCase file stem to UPPER_SNAKE constant, pokered style:
 *   PalletTown    -> PALLET_TOWN
 *   MtMoon1F      -> MT_MOON_1F
 *   SSAnne1FRooms -> SS_ANNE_1F_ROOMS
 *   Route16FlyHouse -> ROUTE_16_FLY_HOUSE
 *
 * Rules run in order and each sees the output of the previous one.
 */
public class CamelCaseMapNameNormalizer implements MapNameNormalizer {

    private static final List<Rule> RULES = List.of(
        new Rule("([a-z])([A-Z0-9])"),
        new Rule("([A-Z]+)([A-Z][a-z])"),
        new Rule("([a-z])([0-9])"),
        // floor numbers (1F, B2F) stay joined
        new Rule("([0-9])([A-EG-Z])"),
        new Rule("([0-9]F)([A-Z])"),
        new Rule("([0-9])(Fly)")
    );

    @Override
    public String toConstant(String fileStem) {
        if (fileStem == null) {
            return "";
        }
        String result = fileStem;
        for (Rule rule : RULES) {
            result = rule.apply(result);
        }
        return result.toUpperCase(Locale.ROOT);
    }

    private static final class Rule {
        private final Pattern pattern;

        Rule(String regex) {
            this.pattern = Pattern.compile(regex);
        }

        String apply(String input) {
            return pattern.matcher(input).replaceAll("$1_$2");
        }
    }
}
