package com.nicolaswinsten.lootsync.world;

import com.nicolaswinsten.lootsync.MutableClock;
import com.nicolaswinsten.lootsync.TestSupport;
import com.nicolaswinsten.lootsync.error.ConflictException;
import com.nicolaswinsten.lootsync.error.NotFoundException;
import com.nicolaswinsten.lootsync.error.ValidationException;
import com.nicolaswinsten.lootsync.sync.EventFanout;
import com.nicolaswinsten.lootsync.sync.EventType;
import com.nicolaswinsten.lootsync.sync.SyncMessages.FindsReset;
import com.nicolaswinsten.lootsync.sync.SyncMessages.ObjectCollected;
import com.nicolaswinsten.lootsync.sync.SyncMessages.ObjectDeleted;
import com.nicolaswinsten.lootsync.sync.SyncMessages.ObjectUncollected;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class WorldStateServiceTest {

    @Mock
    EventFanout eventFanout;

    @Captor
    ArgumentCaptor<Object> dataCaptor;

    EmbeddedDatabase database;
    MutableClock clock;
    WorldStateService service;

    @BeforeEach
    void setUp() {
        database = TestSupport.database();
        clock = new MutableClock(Instant.parse("2025-06-01T12:00:00Z"));
        FindLedger findLedger = new FindLedger(new NamedParameterJdbcTemplate(database));
        service = new WorldStateService(
            new WorldStore(new JdbcTemplate(database)),
            findLedger,
            TestSupport.storeWriter(database, TestSupport.properties()),
            new VisibilityResolver(),
            eventFanout,
            clock);
    }

    @AfterEach
    void tearDown() {
        database.shutdown();
    }

    private ObjectView create(String id, boolean multifindable) {
        ObjectView view = service.createObject(new ObjectDraft(
            id, "Chest " + id, "chalice", 40.0, -105.0, 5.0, "creator", null, null, multifindable));
        clock.advance(Duration.ofSeconds(1));
        return view;
    }

    // ── createObject ────────────────────────────────────────────────────────

    @Test
    void createStoresObjectAndBroadcastsIt() {
        ObjectView created = create("O1", false);

        assertThat(created.collected()).isFalse();
        assertThat(created.createdAt()).isEqualTo(Instant.parse("2025-06-01T12:00:00Z"));
        verify(eventFanout).broadcast(eq(EventType.OBJECT_CREATED), dataCaptor.capture());
        assertThat(dataCaptor.getValue()).isEqualTo(created);
        assertThat(service.getObject("O1", null).name()).isEqualTo("Chest O1");
    }

    @Test
    void createWithoutCreatorRecordsUnknown() {
        ObjectView created = service.createObject(new ObjectDraft(
            "O1", "Chest", "chalice", 40.0, -105.0, 5.0, "  ", null, null, null));

        assertThat(created.createdBy()).isEqualTo(WorldObject.UNKNOWN_CREATOR);
        assertThat(created.multifindable()).isFalse();
    }

    @Test
    void createWithMissingFieldIsRejectedBeforeStoring() {
        assertThatThrownBy(() -> service.createObject(new ObjectDraft(
            "O1", "Chest", "chalice", null, -105.0, 5.0, null, null, null, null)))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("latitude");

        assertThat(service.listObjects(ObjectFilter.everything(null))).isEmpty();
        verifyNoInteractions(eventFanout);
    }

    @Test
    void duplicateIdIsAConflictAndKeepsTheOriginal() {
        create("O1", false);
        reset(eventFanout);

        assertThatThrownBy(() -> service.createObject(new ObjectDraft(
            "O1", "Impostor", "chalice", 1.0, 1.0, 1.0, null, null, null, null)))
            .isInstanceOf(ConflictException.class);

        List<ObjectView> all = service.listObjects(ObjectFilter.everything(null));
        assertThat(all).extracting(ObjectView::id).containsExactly("O1");
        assertThat(all.get(0).name()).isEqualTo("Chest O1");
        verifyNoInteractions(eventFanout);
    }

    @Test
    void idIsKeptExactlyAsSent() {
        create(" O1", false);

        assertThat(service.getObject(" O1", null).id()).isEqualTo(" O1");
        assertThat(service.markFound(" O1", "userA").objectId()).isEqualTo(" O1");
        assertThatThrownBy(() -> service.getObject("O1", null)).isInstanceOf(NotFoundException.class);
        assertThat(service.deleteObject(" O1")).isEqualTo(1);
    }

    @Test
    void concurrentCreatesWithSameIdLetExactlyOneThrough() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        Callable<String> attempt = () -> {
            start.await();
            try {
                service.createObject(new ObjectDraft("X", "Racer", "chalice", 40.0, -105.0, 5.0, null, null, null, null));
                return "created";
            } catch (ConflictException e) {
                return "conflict";
            }
        };
        List<Future<String>> results = new ArrayList<>();
        try {
            results.add(executor.submit(attempt));
            results.add(executor.submit(attempt));
            start.countDown();
            List<String> outcomes = new ArrayList<>();
            for (Future<String> result : results) {
                outcomes.add(result.get(10, TimeUnit.SECONDS));
            }
            assertThat(outcomes).containsExactlyInAnyOrder("created", "conflict");
        } finally {
            executor.shutdownNow();
        }

        assertThat(service.listObjects(ObjectFilter.everything(null)))
            .extracting(ObjectView::id)
            .containsExactly("X");
        verify(eventFanout, times(1)).broadcast(eq(EventType.OBJECT_CREATED), any());
    }

    // ── listObjects ─────────────────────────────────────────────────────────

    @Test
    void listIsNewestFirst() {
        create("old", false);
        create("mid", false);
        create("new", false);

        assertThat(service.listObjects(ObjectFilter.everything(null)))
            .extracting(ObjectView::id)
            .containsExactly("new", "mid", "old");
    }

    @Test
    void listFiltersByBoundingBox() {
        create("near", false);
        service.createObject(new ObjectDraft("far", "Far", "chalice", 41.0, -105.0, 5.0, null, null, null, null));

        List<ObjectView> nearby = service.listObjects(new ObjectFilter(40.0, -105.0, 1_000.0, true, null));

        assertThat(nearby).extracting(ObjectView::id).containsExactly("near");
    }

    @Test
    void negativeRadiusIsRejected() {
        assertThatThrownBy(() -> service.listObjects(new ObjectFilter(40.0, -105.0, -1.0, true, null)))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    void halfSpecifiedCenterIsRejected() {
        create("O1", false);

        assertThatThrownBy(() -> service.listObjects(new ObjectFilter(40.0, null, 1_000.0, true, null)))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("longitude");
        assertThatThrownBy(() -> service.listObjects(new ObjectFilter(null, -105.0, null, true, null)))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("latitude");
    }

    // ── Visibility scenarios ────────────────────────────────────────────────

    @Test
    void singleFindObjectIsHiddenFromEveryoneOnceFound() {
        create("O1", false);
        service.markFound("O1", "userA");

        assertThat(service.listObjects(new ObjectFilter(null, null, null, false, null))).isEmpty();
        assertThat(service.listObjects(new ObjectFilter(null, null, null, false, "userB"))).isEmpty();

        List<ObjectView> withFound = service.listObjects(new ObjectFilter(null, null, null, true, null));
        assertThat(withFound).hasSize(1);
        assertThat(withFound.get(0).collected()).isTrue();
        assertThat(withFound.get(0).foundBy()).isEqualTo("userA");
    }

    @Test
    void multiFindObjectStaysVisibleToOtherViewers() {
        create("O2", true);
        service.markFound("O2", "userA");

        assertThat(service.getObject("O2", "userB").collected()).isFalse();
        assertThat(service.getObject("O2", "userA").collected()).isTrue();
        assertThat(service.listObjects(new ObjectFilter(null, null, null, false, "userB")))
            .extracting(ObjectView::id)
            .containsExactly("O2");
        assertThat(service.listObjects(new ObjectFilter(null, null, null, false, "userA"))).isEmpty();
    }

    @Test
    void multiFindRecordsOneRowPerFinder() {
        create("O2", true);
        List<String> finders = List.of("userA", "userB", "userC");
        for (String finder : finders) {
            service.markFound("O2", finder);
        }

        assertThat(service.findsFor("O2")).extracting(Find::foundBy).containsExactlyElementsOf(finders);
        for (String finder : finders) {
            assertThat(service.getObject("O2", finder).collected()).isTrue();
        }
        assertThat(service.getObject("O2", "userD").collected()).isFalse();
        assertThat(service.getObject("O2", "userD").findCount()).isEqualTo(3);
    }

    @Test
    void repeatFindsBySameFinderAreAllRecorded() {
        create("O1", false);
        service.markFound("O1", "userA");
        service.markFound("O1", "userA");

        assertThat(service.findsFor("O1")).hasSize(2);
        assertThat(service.findsBy("userA")).hasSize(2);
    }

    // ── markFound / unmarkFound / reset ─────────────────────────────────────

    @Test
    void markFoundBroadcastsCollected() {
        create("O1", false);

        Find find = service.markFound("O1", " userA ");

        assertThat(find.foundBy()).isEqualTo("userA");
        verify(eventFanout).broadcast(eq(EventType.OBJECT_COLLECTED), dataCaptor.capture());
        ObjectCollected event = (ObjectCollected) dataCaptor.getValue();
        assertThat(event.objectId()).isEqualTo("O1");
        assertThat(event.foundBy()).isEqualTo("userA");
        assertThat(event.foundAt()).isEqualTo(find.foundAt());
    }

    @Test
    void markFoundOnUnknownObjectIsNotFound() {
        assertThatThrownBy(() -> service.markFound("missing", "userA")).isInstanceOf(NotFoundException.class);
        verifyNoInteractions(eventFanout);
    }

    @Test
    void markFoundWithoutFinderIsRejected() {
        create("O1", false);
        assertThatThrownBy(() -> service.markFound("O1", "")).isInstanceOf(ValidationException.class);
        assertThat(service.findsFor("O1")).isEmpty();
    }

    @Test
    void unmarkWithoutFindsSucceedsWithZero() {
        create("O1", false);

        assertThat(service.unmarkFound("O1")).isZero();
        assertThat(service.unmarkFound("never-existed")).isZero();
    }

    @Test
    void unmarkRemovesEveryFindAndBroadcasts() {
        create("O1", true);
        service.markFound("O1", "userA");
        service.markFound("O1", "userB");

        assertThat(service.unmarkFound("O1")).isEqualTo(2);

        assertThat(service.findsFor("O1")).isEmpty();
        verify(eventFanout).broadcast(eq(EventType.OBJECT_UNCOLLECTED), dataCaptor.capture());
        assertThat(dataCaptor.getValue()).isEqualTo(new ObjectUncollected("O1", 2));
    }

    @Test
    void resetRemovesAllFinds() {
        create("O1", false);
        create("O2", true);
        service.markFound("O1", "userA");
        service.markFound("O2", "userA");
        service.markFound("O2", "userB");

        assertThat(service.resetAllFinds()).isEqualTo(3);

        assertThat(service.stats().totalFinds()).isZero();
        verify(eventFanout).broadcast(EventType.ALL_FINDS_RESET, new FindsReset(3));
    }

    // ── deleteObject ────────────────────────────────────────────────────────

    @Test
    void deleteCascadesToFinds() {
        create("O1", true);
        service.markFound("O1", "userA");
        service.markFound("O1", "userB");

        assertThat(service.deleteObject("O1")).isEqualTo(2);

        assertThat(service.findsFor("O1")).isEmpty();
        assertThatThrownBy(() -> service.getObject("O1", null)).isInstanceOf(NotFoundException.class);
        verify(eventFanout).broadcast(EventType.OBJECT_DELETED, new ObjectDeleted("O1", 2));
    }

    @Test
    void deleteOfUnknownObjectIsNotFoundAndBroadcastsNothing() {
        assertThatThrownBy(() -> service.deleteObject("missing")).isInstanceOf(NotFoundException.class);
        verifyNoInteractions(eventFanout);
    }

    // ── Partial updates ─────────────────────────────────────────────────────

    @Test
    void updateLocationMovesObjectAndBroadcastsUpdate() {
        create("O1", false);

        ObjectView moved = service.updateLocation("O1", 41.5, -104.5);

        assertThat(moved.latitude()).isEqualTo(41.5);
        assertThat(moved.longitude()).isEqualTo(-104.5);
        verify(eventFanout).broadcast(EventType.OBJECT_UPDATED, moved);
    }

    @Test
    void updateWithNoFieldsIsRejected() {
        create("O1", false);

        assertThatThrownBy(() -> service.updateLocation("O1", null, null)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> service.updateGrounding("O1", null)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> service.updateArOffset("O1", ArPlacement.none())).isInstanceOf(ValidationException.class);
    }

    @Test
    void updateOfUnknownObjectIsNotFound() {
        assertThatThrownBy(() -> service.updateLocation("missing", 1.0, 2.0)).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> service.updateGrounding("missing", 1.0)).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> service.updateArOffset("missing",
            new ArPlacement(null, null, 1.0, null, null, null, null, null)))
            .isInstanceOf(NotFoundException.class);
        verifyNoInteractions(eventFanout);
    }

    @Test
    void groundingUpdateIsStored() {
        create("O1", false);

        service.updateGrounding("O1", 1.25);

        assertThat(service.getObject("O1", null).groundingHeight()).isEqualTo(1.25);
    }

    @Test
    void arOffsetUpdateKeepsFieldsItDoesNotMention() {
        Instant placedAt = Instant.parse("2025-05-31T08:00:00Z");
        service.createObject(new ObjectDraft("O1", "Chest", "chalice", 40.0, -105.0, 5.0, null, null,
            new ArPlacement(40.0, -105.0, 1.0, 2.0, 3.0, placedAt, "opaque-blob", 90.0), false));

        service.updateArOffset("O1", new ArPlacement(null, null, 5.0, null, null, null, null, null));

        ArPlacement stored = service.getObject("O1", null).arPlacement();
        assertThat(stored.offsetX()).isEqualTo(5.0);
        assertThat(stored.offsetY()).isEqualTo(2.0);
        assertThat(stored.placementTimestamp()).isEqualTo(placedAt);
        assertThat(stored.anchorTransform()).isEqualTo("opaque-blob");
        assertThat(stored.placementHeading()).isEqualTo(90.0);
    }

    // ── stats ───────────────────────────────────────────────────────────────

    @Test
    void statsCountObjectsFindsAndTopFinders() {
        create("O1", false);
        create("O2", true);
        create("O3", false);
        service.markFound("O1", "userA");
        service.markFound("O2", "userA");
        service.markFound("O2", "userB");

        WorldStats stats = service.stats();

        assertThat(stats.totalObjects()).isEqualTo(3);
        assertThat(stats.foundObjects()).isEqualTo(2);
        assertThat(stats.unfoundObjects()).isEqualTo(1);
        assertThat(stats.totalFinds()).isEqualTo(3);
        assertThat(stats.topFinders()).extracting(WorldStats.TopFinder::user).containsExactly("userA", "userB");
        assertThat(stats.topFinders().get(0).count()).isEqualTo(2);
    }
}
