package org.iceforge.warden.schema;

import org.h2.jdbcx.JdbcDataSource;
import org.iceforge.warden.cache.CacheManager;
import org.iceforge.warden.cache.CacheSettings;
import org.iceforge.warden.cache.CacheTier;
import org.iceforge.warden.cache.InMemoryCacheStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class SchemaCatalogTest {

    private JdbcDataSource ds;
    private CacheManager cache;

    @BeforeEach
    void setUp() throws SQLException {
        ds = new JdbcDataSource();
        ds.setURL("jdbc:h2:mem:schema-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        try (Connection c = ds.getConnection(); Statement s = c.createStatement()) {
            s.execute("CREATE TABLE customers(id INT, name VARCHAR(20), Email VARCHAR(50))");
        }
        cache = new CacheManager(new InMemoryCacheStore(), CacheSettings.defaults());
    }

    @Test
    void underscoreInATableNameIsNotAWildcard() throws SQLException {
        try (Connection c = ds.getConnection(); Statement s = c.createStatement()) {
            s.execute("CREATE TABLE orderXitems(id INT, secret VARCHAR(20))");
        }
        JdbcSchemaMetadataSource source = new JdbcSchemaMetadataSource(ds);

        assertEquals(Optional.empty(), source.describe("public", "order_items"));

        try (Connection c = ds.getConnection(); Statement s = c.createStatement()) {
            s.execute("CREATE TABLE order_items(id INT, qty INT)");
        }
        assertEquals(List.of("id", "qty"), source.describe("public", "order_items").orElseThrow().columns());
    }

    @Test
    void patternCharactersAreEscapedWithTheDriverEscape() {
        assertEquals("order\\_items", JdbcSchemaMetadataSource.escapePattern("order_items", "\\"));
        assertEquals("a\\%b\\\\c", JdbcSchemaMetadataSource.escapePattern("a%b\\c", "\\"));
        assertEquals("order_items", JdbcSchemaMetadataSource.escapePattern("order_items", ""));
    }

    @Test
    void jdbcSourceFindsUnquotedTablesWhateverTheCatalogCase() {
        JdbcSchemaMetadataSource source = new JdbcSchemaMetadataSource(ds);

        TableSchema t = source.describe("public", "customers").orElseThrow();

        assertEquals(List.of("id", "name", "email"), t.columns());
        assertTrue(t.hasColumn("EMAIL"));
        assertEquals(Optional.empty(), source.describe("public", "nope"));
    }

    @Test
    void catalogCachesDefinitionsOnTheSchemaTier() {
        SchemaMetadataSource source = spy(new JdbcSchemaMetadataSource(ds));
        SchemaCatalog catalog = new SchemaCatalog(source, cache);

        catalog.describe("public", "customers");
        catalog.describe("public", "customers");

        verify(source, times(1)).describe("public", "customers");
        assertEquals(1, cache.stats(CacheTier.SCHEMA).hits());

        catalog.invalidate("public", "customers");
        catalog.describe("public", "customers");
        verify(source, times(2)).describe("public", "customers");
    }

    @Test
    void failingSourceMeansUnknown() {
        SchemaMetadataSource source = mock(SchemaMetadataSource.class);
        when(source.describe("public", "customers")).thenThrow(new IllegalStateException("metadata unavailable"));

        assertEquals(Optional.empty(), new SchemaCatalog(source, cache).describe("public", "customers"));
    }
}
