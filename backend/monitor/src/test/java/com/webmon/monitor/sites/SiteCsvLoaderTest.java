package com.webmon.monitor.sites;

import com.webmon.core.model.Site;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SiteCsvLoaderTest {
    @TempDir
    Path dir;

    @Test
    void readsRowsAfterHeaderAndNormalizesHosts() throws Exception {
        Path file = write("host,interval,pattern\nfoo.com,5,\nbar.io:8080/health,10,\"ok, fine\"\n\nbaz.net,0\n");

        List<Site> sites = SiteCsvLoader.load(file);

        assertEquals(3, sites.size());
        assertEquals(Site.unsaved("https://foo.com:443", 5, ""), sites.get(0));
        assertEquals(Site.unsaved("http://bar.io:8080/health", 10, "ok, fine"), sites.get(1));
        assertEquals(Site.unsaved("https://baz.net:443", 0, ""), sites.get(2));
    }

    @Test
    void firstRowIsDataWhenItIsNotAHeader() throws Exception {
        Path file = write("foo.com,5\nbar.io,7\n");

        List<Site> sites = SiteCsvLoader.load(file);

        assertEquals(2, sites.size());
        assertEquals("https://foo.com:443", sites.get(0).url());
    }

    @Test
    void firstRowMentioningHostAndIntervalInItsUrlIsStillData() throws Exception {
        Path file = write("localhost:8080/interval,5\nfoo.com,10\n");

        List<Site> sites = SiteCsvLoader.load(file);

        assertEquals(2, sites.size());
        assertEquals("http://localhost:8080/interval", sites.get(0).url());
        assertEquals("https://foo.com:443", sites.get(1).url());
    }

    @Test
    void headerCellsAreMatchedIgnoringCaseAndPadding() throws Exception {
        Path file = write(" Host , INTERVAL ,pattern\nfoo.com,10\n");

        assertEquals(1, SiteCsvLoader.load(file).size());
    }

    @Test
    void errorNamesThePhysicalLineAfterBlankLines() throws Exception {
        Path file = write("host,interval\n\n\nfoo.com,5\n\nbar.io,never\n");

        SiteListException error = assertThrows(SiteListException.class, () -> SiteCsvLoader.load(file));
        assertTrue(error.getMessage().contains("line 6"), error.getMessage());
    }

    @Test
    void patternIsKeptVerbatim() throws Exception {
        Path file = write("foo.com,5,\" <title>Foo</title> \"\n");

        assertEquals(" <title>Foo</title> ", SiteCsvLoader.load(file).get(0).contentPattern());
    }

    @Test
    void rejectsNegativeInterval() throws Exception {
        Path file = write("foo.com,-5\n");

        SiteListException error = assertThrows(SiteListException.class, () -> SiteCsvLoader.load(file));
        assertTrue(error.getMessage().contains(file.toString()));
        assertTrue(error.getMessage().contains("line 1"));
    }

    @Test
    void rejectsNonIntegerInterval() throws Exception {
        Path file = write("host,interval\nfoo.com,soon\n");

        SiteListException error = assertThrows(SiteListException.class, () -> SiteCsvLoader.load(file));
        assertTrue(error.getMessage().contains("line 2"), error.getMessage());
    }

    @Test
    void rejectsWrongColumnCount() throws Exception {
        assertThrows(SiteListException.class, () -> SiteCsvLoader.load(write("foo.com\n")));
        assertThrows(SiteListException.class, () -> SiteCsvLoader.load(write("foo.com,1,a,b\n")));
    }

    @Test
    void missingFileIsReportedAsSiteListProblem() {
        Path missing = dir.resolve("nope.csv");

        SiteListException error = assertThrows(SiteListException.class, () -> SiteCsvLoader.load(missing));
        assertTrue(error.getMessage().contains("nope.csv"));
    }

    @Test
    void emptyFileYieldsNoSites() throws Exception {
        assertTrue(SiteCsvLoader.load(write("")).isEmpty());
    }

    private Path write(String content) throws Exception {
        Path file = Files.createTempFile(dir, "sites", ".csv");
        Files.writeString(file, content);
        return file;
    }
}
