package com.webmon.service.store;

import com.webmon.core.model.Site;
import com.webmon.service.support.TestDatabases;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SiteRegistryTest {
    private StorageDriver driver;
    private ResultSink sink;

    @BeforeEach
    void setUp() throws Exception {
        driver = TestDatabases.openH2(TestDatabases.uniqueName());
        sink = TestDatabases.sink(driver);
        Tables.createAll(sink);
    }

    @AfterEach
    void tearDown() {
        driver.close();
    }

    @Test
    void emptyStoreWithoutSuppliedSitesFails() {
        assertThrows(EmptySiteStoreException.class, () -> new SiteRegistry(sink).reconcile(List.of()));
    }

    @Test
    void suppliedSitesAreMergedWithStoredOnes() throws Exception {
        SiteRegistry registry = new SiteRegistry(sink);
        registry.reconcile(List.of(Site.unsaved("https://a.com:443", 1, "")));

        List<Site> sites = registry.reconcile(List.of(
                Site.unsaved("https://a.com:443", 1, ""),
                Site.unsaved("https://b.com:443", 2, "")
        ));

        assertEquals(2, sites.size());
        assertEquals(sites, sink.fetchAll(Tables.WEBSITES, Tables.WEBSITE_SHAPE));
        assertTrue(sites.stream().allMatch(Site::persisted));
    }

    @Test
    void storedSitesAloneAreEnough() throws Exception {
        new SiteRegistry(sink).reconcile(List.of(Site.unsaved("https://a.com:443", 1, "")));

        List<Site> sites = new SiteRegistry(sink).reconcile(List.of());

        assertEquals(1, sites.size());
        assertEquals("https://a.com:443", sites.get(0).url());
    }
}
