package com.stockscan.data;

import com.stockscan.model.Instrument;
import com.stockscan.model.ListingStatus;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Reads the instrument universe from a {@code code,name,status} CSV. The header is optional and status defaults to ACTIVE.
 */
public final class UniverseLoader {
    private UniverseLoader() {
    }

    public static List<Instrument> load(Path file) throws IOException {
        return parse(Files.readAllLines(file, StandardCharsets.UTF_8), file.toString());
    }

    static List<Instrument> parse(List<String> lines, String source) {
        List<Instrument> out = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        int lineNo = 0;
        for (String line : lines) {
            lineNo++;
            String text = line.strip();
            if (lineNo == 1 && text.startsWith("\uFEFF")) {
                text = text.substring(1);
            }
            if (text.isEmpty() || text.startsWith("#")) {
                continue;
            }
            String[] cols = text.split(",", -1);
            String code = cols[0].trim();
            if (out.isEmpty() && seen.isEmpty() && "code".equals(code.toLowerCase(Locale.ROOT))) {
                continue;
            }
            if (code.isEmpty()) {
                throw new IllegalArgumentException(source + ":" + lineNo + " missing code");
            }
            if (!seen.add(code)) {
                throw new IllegalArgumentException(source + ":" + lineNo + " duplicate code " + code);
            }
            String name = cols.length > 1 ? cols[1].trim() : "";
            ListingStatus status;
            try {
                status = ListingStatus.fromLabel(cols.length > 2 ? cols[2] : "");
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException(source + ":" + lineNo + " " + e.getMessage(), e);
            }
            out.add(new Instrument(code, name.isEmpty() ? code : name, status));
        }
        return out;
    }
}
