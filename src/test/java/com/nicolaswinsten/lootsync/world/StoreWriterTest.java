package com.nicolaswinsten.lootsync.world;

import com.nicolaswinsten.lootsync.TestSupport;
import com.nicolaswinsten.lootsync.error.ErrorKind;
import com.nicolaswinsten.lootsync.error.NotFoundException;
import com.nicolaswinsten.lootsync.error.StorageBusyException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class StoreWriterTest {

    EmbeddedDatabase database;
    StoreWriter writer;

    @BeforeEach
    void setUp() {
        database = TestSupport.database();
        writer = TestSupport.storeWriter(database, TestSupport.properties(Duration.ofMillis(200)));
    }

    @AfterEach
    void tearDown() {
        database.shutdown();
    }

    @Test
    void transientFailuresAreRetriedUntilTheWriteGoesThrough() {
        AtomicInteger attempts = new AtomicInteger();

        String result = writer.write("flaky", () -> {
            if (attempts.incrementAndGet() < 3) {
                throw new CannotAcquireLockException("database is busy");
            }
            return "ok";
        });

        assertThat(result).isEqualTo("ok");
        assertThat(attempts).hasValue(3);
    }

    @Test
    void exhaustedRetriesSurfaceAsStorageBusy() {
        AtomicInteger attempts = new AtomicInteger();

        StorageBusyException busy = catchThrowableOfType(() -> writer.run("always busy", () -> {
            attempts.incrementAndGet();
            throw new CannotAcquireLockException("database is busy");
        }), StorageBusyException.class);

        assertThat(busy).hasCauseInstanceOf(CannotAcquireLockException.class);
        assertThat(busy.getKind()).isEqualTo(ErrorKind.TRANSIENT_STORAGE_BUSY);
        assertThat(attempts).hasValue(3);
    }

    @Test
    void nonTransientFailuresAreNotRetried() {
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> writer.run("lookup", () -> {
            attempts.incrementAndGet();
            throw NotFoundException.object("O1");
        })).isInstanceOf(NotFoundException.class);
        assertThat(attempts).hasValue(1);
    }

    @Test
    void failedWriteIsRolledBack() {
        JdbcTemplate jdbc = new JdbcTemplate(database);

        assertThatThrownBy(() -> writer.run("half done", () -> {
            jdbc.update("INSERT INTO players (device_uuid, player_name, created_at, updated_at)"
                + " VALUES ('dev-1', 'Alice', CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)");
            throw NotFoundException.player("dev-2");
        })).isInstanceOf(NotFoundException.class);

        assertThat(jdbc.queryForObject("SELECT COUNT(*) FROM players", Integer.class)).isZero();
    }

    @Test
    void writerWaitingTooLongForItsTurnIsToldTheStoreIsBusy() throws Exception {
        CountDownLatch holding = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<?> slowWrite = executor.submit(() -> writer.run("slow", () -> {
                holding.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }));
            assertThat(holding.await(5, TimeUnit.SECONDS)).isTrue();

            assertThatThrownBy(() -> writer.run("impatient", () -> { }))
                .isInstanceOf(StorageBusyException.class);

            release.countDown();
            slowWrite.get(5, TimeUnit.SECONDS);
        } finally {
            executor.shutdownNow();
        }
    }
}
