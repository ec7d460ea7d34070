package electoral.analytics.ingest.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits one delimited line into fields, honouring double-quoted fields.
 *
 * Examples with ';':
 *   "SP;2022;13" -> ["SP", "2022", "13"]
 *   "\"SAO PAULO; CAPITAL\";13" -> ["SAO PAULO; CAPITAL", "13"]
 *   "\"Joao \"\"Bigode\"\"\";13" -> ["Joao \"Bigode\"", "13"]
 */
public class DelimitedLineParser {

    private final char delimiter;

    public DelimitedLineParser(char delimiter) {
        this.delimiter = delimiter;
    }

    /**
     * Parse a line into trimmed field values.
     *
     * @param line the raw line, without line terminator
     * @return list of field values
     */
    public List<String> split(String line) {
        List<String> values = new ArrayList<>();
        boolean inQuotes = false;
        StringBuilder currentValue = new StringBuilder();

        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);

            if (c == '"') {
                // "" inside a quoted field is a literal quote
                if (inQuotes && i + 1 < line.length() && line.charAt(i + 1) == '"') {
                    currentValue.append('"');
                    i++;
                } else {
                    inQuotes = !inQuotes;
                }
            } else if (c == delimiter && !inQuotes) {
                values.add(currentValue.toString().trim());
                currentValue = new StringBuilder();
            } else {
                currentValue.append(c);
            }
        }

        values.add(currentValue.toString().trim());

        return values;
    }

    /**
     * True when every opened quote is closed. Escaped quotes come in pairs and keep the count even.
     */
    public static boolean hasBalancedQuotes(String line) {
        int quotes = 0;
        for (int i = 0; i < line.length(); i++) {
            if (line.charAt(i) == '"') {
                quotes++;
            }
        }
        return quotes % 2 == 0;
    }

    public char getDelimiter() {
        return delimiter;
    }
}
