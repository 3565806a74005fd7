package com.di.epistream.load;

import com.di.epistream.TestFixtures;
import com.di.epistream.model.QualityFlag;
import com.di.epistream.sql.SqlQueriesProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDate;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@DisplayName("JdbcCaseStore Tests")
class JdbcCaseStoreTest {

    private static final LocalDate DAY = LocalDate.of(2021, 3, 20);
    private static final String UPSERT = "INSERT INTO covid_cases ... ON CONFLICT ... WHERE hash differs";
    private static final String REWRITE = "INSERT INTO covid_cases ... ON CONFLICT ... DO UPDATE";

    private JdbcTemplate jdbc;
    private JdbcCaseStore store;

    @BeforeEach
    void setUp() {
        jdbc = mock(JdbcTemplate.class);
        TransactionTemplate transactionTemplate = mock(TransactionTemplate.class);
        when(transactionTemplate.execute(any())).thenAnswer(invocation -> {
            TransactionCallback<?> callback = invocation.getArgument(0);
            return callback.doInTransaction(mock(TransactionStatus.class));
        });
        SqlQueriesProperties sql = new SqlQueriesProperties();
        sql.getCases().setUpsert(UPSERT);
        sql.getCases().setRewrite(REWRITE);
        sql.getCases().setFindHashesInRange("SELECT date, data_hash FROM covid_cases");
        store = spy(new JdbcCaseStore(jdbc, transactionTemplate, sql, TestFixtures.CLOCK));
    }

    @Test
    @DisplayName("Should upsert new and changed rows in one batch and skip matching hashes")
    @SuppressWarnings("unchecked")
    void testWritePartition() {
        doReturn(Map.of(DAY, "same", DAY.plusDays(1), "old")).when(store).findHashes("DEU", DAY, DAY.plusDays(2));
        when(jdbc.batchUpdate(eq(UPSERT), anyList())).thenReturn(new int[]{1, 1});
        CountryPartition partition = new CountryPartition("DEU", List.of(
                IncrementalLoaderTest.row("DEU", DAY, "same"),
                IncrementalLoaderTest.row("DEU", DAY.plusDays(1), "new"),
                IncrementalLoaderTest.row("DEU", DAY.plusDays(2), "fresh")), false);

        PartitionResult result = store.writePartition(partition);

        assertEquals(new PartitionResult(1, 1, 1), result);
        ArgumentCaptor<List<Object[]>> batch = ArgumentCaptor.forClass(List.class);
        verify(jdbc).batchUpdate(eq(UPSERT), batch.capture());
        verify(jdbc, never()).batchUpdate(eq(REWRITE), anyList());
        assertEquals(2, batch.getValue().size());
        Object[] changed = batch.getValue().get(0);
        assertEquals(24, changed.length);
        assertEquals("DEU", changed[0]);
        assertEquals(java.sql.Date.valueOf(DAY.plusDays(1)), changed[1]);
        assertEquals("new", changed[21]);
        assertEquals("fresh", batch.getValue().get(1)[21]);
    }

    @Test
    @DisplayName("Should turn a row inserted by a concurrent run into an update or a no-op")
    void testWritePartition_ConcurrentWriter() {
        // both keys were absent when the hashes were read; another run wrote them before the batch
        doReturn(Map.of()).when(store).findHashes("DEU", DAY, DAY.plusDays(1));
        when(jdbc.batchUpdate(eq(UPSERT), anyList())).thenReturn(new int[]{0, 1});
        CountryPartition partition = new CountryPartition("DEU", List.of(
                IncrementalLoaderTest.row("DEU", DAY, "same-as-concurrent"),
                IncrementalLoaderTest.row("DEU", DAY.plusDays(1), "ours")), false);

        PartitionResult result = assertDoesNotThrow(() -> store.writePartition(partition));

        assertEquals(new PartitionResult(1, 0, 1), result);
    }

    @Test
    @DisplayName("Should count rows from the hash lookup when the driver reports no row counts")
    void testWritePartition_NoRowCounts() {
        doReturn(Map.of(DAY, "old")).when(store).findHashes("DEU", DAY, DAY.plusDays(1));
        when(jdbc.batchUpdate(eq(UPSERT), anyList()))
                .thenReturn(new int[]{java.sql.Statement.SUCCESS_NO_INFO, java.sql.Statement.SUCCESS_NO_INFO});
        CountryPartition partition = new CountryPartition("DEU", List.of(
                IncrementalLoaderTest.row("DEU", DAY, "new"),
                IncrementalLoaderTest.row("DEU", DAY.plusDays(1), "fresh")), false);

        assertEquals(new PartitionResult(1, 1, 0), store.writePartition(partition));
    }

    @Test
    @DisplayName("Should rewrite every row unconditionally on a forced rewrite")
    void testWritePartition_Force() {
        doReturn(Map.of(DAY, "same")).when(store).findHashes("DEU", DAY, DAY);
        when(jdbc.batchUpdate(eq(REWRITE), anyList())).thenReturn(new int[]{1});
        CountryPartition partition = new CountryPartition("DEU",
                List.of(IncrementalLoaderTest.row("DEU", DAY, "same")), true);

        assertEquals(new PartitionResult(0, 1, 0), store.writePartition(partition));
        verify(jdbc, never()).batchUpdate(eq(UPSERT), anyList());
    }

    @Test
    @DisplayName("Should not touch the database when every hash matches")
    void testWritePartition_AllUnchanged() {
        doReturn(Map.of(DAY, "same")).when(store).findHashes("DEU", DAY, DAY);
        CountryPartition partition = new CountryPartition("DEU",
                List.of(IncrementalLoaderTest.row("DEU", DAY, "same")), false);

        assertEquals(new PartitionResult(0, 0, 1), store.writePartition(partition));
        verify(jdbc, never()).batchUpdate(anyString(), anyList());
    }

    @Test
    @DisplayName("Should propagate batch failures so the transaction rolls back")
    void testWritePartition_Failure() {
        doReturn(Map.of()).when(store).findHashes("DEU", DAY, DAY);
        when(jdbc.batchUpdate(eq(UPSERT), anyList())).thenThrow(new DataIntegrityViolationException("foreign key"));
        CountryPartition partition = new CountryPartition("DEU",
                List.of(IncrementalLoaderTest.row("DEU", DAY, "h")), false);

        assertThrows(DataIntegrityViolationException.class, () -> store.writePartition(partition));
    }

    @Test
    @DisplayName("Should store flags as a sorted comma list and read them back")
    void testFlagsColumn() {
        assertNull(JdbcCaseStore.formatFlags(Set.of()));
        assertEquals("ANOMALOUS_SPIKE,LOW_CONFIDENCE",
                JdbcCaseStore.formatFlags(EnumSet.of(QualityFlag.LOW_CONFIDENCE, QualityFlag.ANOMALOUS_SPIKE)));
        assertEquals(EnumSet.of(QualityFlag.LOW_CONFIDENCE, QualityFlag.ANOMALOUS_SPIKE),
                JdbcCaseStore.parseFlags("LOW_CONFIDENCE, ANOMALOUS_SPIKE"));
        assertTrue(JdbcCaseStore.parseFlags(null).isEmpty());
    }
}
