package qarunner.player;

import org.openqa.selenium.By;

import java.util.Locale;

/**
 * Converts locator strings from test definitions into Selenium {@link By}s.
 *
 * <p>Accepted forms: {@code xpath=...}, {@code css=...}, {@code id=...},
 * {@code name=...}, {@code text=...}; a bare string starting with {@code /}
 * or {@code (/} is XPath, anything else CSS.
 */
public final class Locators {

    private Locators() {}

    public static By toBy(String locator) {
        if (locator == null || locator.isBlank()) {
            throw new QaRunnerException("Locator must not be blank");
        }
        String value = locator.trim();
        String lower = value.toLowerCase(Locale.ROOT);

        if (lower.startsWith("xpath="))  return By.xpath(value.substring(6));
        if (lower.startsWith("css="))    return By.cssSelector(value.substring(4));
        if (lower.startsWith("id="))     return By.id(value.substring(3));
        if (lower.startsWith("name="))   return By.name(value.substring(5));
        if (lower.startsWith("text="))   return By.xpath(textXpath(value.substring(5)));
        if (isXpath(value))              return By.xpath(value);
        return By.cssSelector(value);
    }

    public static boolean isXpath(String locator) {
        return locator.startsWith("/") || locator.startsWith("(/");
    }

    /** XPath matching any element whose normalised text contains {@code text}. */
    public static String textXpath(String text) {
        return "//*[contains(normalize-space(.), " + xpathLiteral(text) + ")]";
    }

    /** Quotes {@code s} as an XPath string literal, using concat() when it holds both quote kinds. */
    public static String xpathLiteral(String s) {
        if (!s.contains("'")) return "'" + s + "'";
        if (!s.contains("\"")) return "\"" + s + "\"";
        StringBuilder sb = new StringBuilder("concat(");
        String[] parts = s.split("'", -1);
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) sb.append(", \"'\", ");
            sb.append('\'').append(parts[i]).append('\'');
        }
        return sb.append(')').toString();
    }
}
