package dev.resumescanner.registry;

import java.util.regex.Pattern;

/**
 * A canonical skill name and the whole-token pattern that finds it.
 */
public record SkillPattern(String name, Pattern pattern) {

    static SkillPattern of(String name) {
        // \b does not work around "C++", "C#" or ".NET", so use explicit word-character guards
        String regex = "(?<![\\w+#])" + Pattern.quote(name) + "(?![\\w+#])";
        return new SkillPattern(name, Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
    }
}
