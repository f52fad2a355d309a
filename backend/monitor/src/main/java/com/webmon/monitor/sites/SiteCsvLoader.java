package com.webmon.monitor.sites;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.webmon.core.model.Site;
import com.webmon.core.url.MalformedUrlException;
import com.webmon.core.url.UrlNormalizer;
import com.webmon.core.util.JsonUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Logger;

// host,interval[,pattern] rows; a first row of exactly "host","interval" is a header.
public final class SiteCsvLoader {
    private static final Logger LOGGER = Logger.getLogger(SiteCsvLoader.class.getName());

    private SiteCsvLoader() {
    }

    public static List<Site> load(Path file) {
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SiteListException(file, "cannot read file (" + e.getMessage() + ")", e);
        }
        ObjectReader rowReader = JsonUtils.csvRowReader();
        List<Site> sites = new ArrayList<>();
        boolean firstRow = true;
        for (int i = 0; i < lines.size(); i++) {
            int lineNumber = i + 1;
            String[] row = parseRow(file, lineNumber, rowReader, lines.get(i));
            if (isBlank(row)) {
                continue;
            }
            if (firstRow) {
                firstRow = false;
                if (isHeader(row)) {
                    continue;
                }
            }
            sites.add(toSite(file, lineNumber, row));
        }
        LOGGER.info("Read " + sites.size() + " sites from " + file);
        return sites;
    }

    private static String[] parseRow(Path file, int lineNumber, ObjectReader rowReader, String line) {
        if (line.isBlank()) {
            return new String[0];
        }
        try (MappingIterator<String[]> cells = rowReader.readValues(line)) {
            return cells.hasNextValue() ? cells.nextValue() : new String[0];
        } catch (IOException e) {
            throw new SiteListException(file, "line " + lineNumber + " is not valid CSV (" + e.getMessage() + ")", e);
        }
    }

    private static Site toSite(Path file, int lineNumber, String[] row) {
        if (row.length < 2 || row.length > 3) {
            throw new SiteListException(file, "line " + lineNumber + " must have 2 or 3 columns but has " + row.length);
        }
        String url;
        try {
            url = UrlNormalizer.normalize(row[0].trim(), false);
        } catch (MalformedUrlException e) {
            throw new SiteListException(file, "line " + lineNumber + ": " + e.getMessage(), e);
        }
        int interval;
        try {
            interval = Integer.parseInt(row[1].trim());
        } catch (NumberFormatException e) {
            throw new SiteListException(file, "line " + lineNumber + ": interval '" + row[1] + "' is not a whole number", e);
        }
        if (interval < 0) {
            throw new SiteListException(file, "line " + lineNumber + ": interval must be >= 0 but was " + interval);
        }
        String pattern = row.length == 3 ? row[2] : "";
        return Site.unsaved(url, interval, pattern);
    }

    private static boolean isHeader(String[] row) {
        return row.length >= 2
                && "host".equalsIgnoreCase(row[0].trim())
                && "interval".equalsIgnoreCase(row[1].trim());
    }

    private static boolean isBlank(String[] row) {
        return Arrays.stream(row).allMatch(cell -> cell == null || cell.isBlank());
    }
}
