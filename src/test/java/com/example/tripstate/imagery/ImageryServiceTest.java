package com.example.tripstate.imagery;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.tripstate.core.BoundedCache;
import com.example.tripstate.refresh.NaiveRefreshStrategy;
import com.example.tripstate.refresh.SupersedingFetcher;
import java.util.ArrayDeque;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ImageryServiceTest {

    private final Queue<Runnable> tasks = new ArrayDeque<>();
    private ImageryClient client;
    private BoundedCache<String, String> cache;
    private ImageryService service;

    @BeforeEach
    void setUp() {
        client = mock(ImageryClient.class);
        cache = new BoundedCache<>(20);
        service = new ImageryService(client, cache, new NaiveRefreshStrategy<>(),
            new SupersedingFetcher<>(cache, tasks::add));
    }

    @Test
    void cacheKeyReplacesEverythingButLettersAndDigits() {
        assertEquals("paris--france", ImageryService.cacheKey("Paris, France"));
        assertEquals("s-o-paulo", ImageryService.cacheKey("São Paulo"));
        assertEquals("new-york-2026", ImageryService.cacheKey("New York 2026"));
    }

    @Test
    void searchesByCityAndCachesPerDestination() {
        when(client.findImageUrl("Kyoto")).thenReturn("https://img/kyoto.jpg");

        assertEquals(Optional.of("https://img/kyoto.jpg"), service.imageFor("Kyoto, Japan"));
        assertEquals(Optional.of("https://img/kyoto.jpg"), service.imageFor("kyoto, japan"));

        verify(client, times(1)).findImageUrl(anyString());
        assertEquals(Optional.of("https://img/kyoto.jpg"), cache.get("kyoto--japan"));
    }

    @Test
    void fallsBackToStaticPhotoWithoutCachingIt() {
        when(client.findImageUrl(anyString())).thenReturn(null);

        Optional<String> image = service.imageFor("Rome, Italy");

        assertTrue(image.isPresent());
        assertTrue(image.get().startsWith("https://images.unsplash.com/"));
        assertEquals(0, service.cacheSize());
    }

    @Test
    void remoteFailureStillFallsBack() {
        when(client.findImageUrl(anyString())).thenThrow(new IllegalStateException("401"));

        assertEquals(ImageryService.staticFallback("Bangkok"), service.imageFor("Bangkok, Thailand"));
        assertTrue(service.imageFor("Ulaanbaatar").isEmpty());
    }

    @Test
    void fallbackNeedsTheExactCity() {
        when(client.findImageUrl(anyString())).thenReturn(null);

        assertTrue(service.imageFor("Jerome, Arizona").isEmpty());
        assertTrue(service.imageFor("Parisville").isEmpty());
        assertEquals(ImageryService.staticFallback("paris"), service.imageFor("PARIS, France"));
        assertTrue(service.imageFor("New York, USA").isPresent());
    }

    @Test
    void asyncLookupResolvesThroughFetcher() throws Exception {
        when(client.findImageUrl("Lisbon")).thenReturn("https://img/lisbon.jpg");

        CompletableFuture<Optional<String>> future = service.imageForAsync("Lisbon, Portugal");
        tasks.forEach(Runnable::run);

        assertEquals(Optional.of("https://img/lisbon.jpg"), future.get());
        assertEquals(1, service.cacheSize());
    }

    @Test
    void canceledAsyncLookupLeavesCacheEmpty() {
        when(client.findImageUrl("Lisbon")).thenReturn("https://img/lisbon.jpg");

        CompletableFuture<Optional<String>> future = service.imageForAsync("Lisbon, Portugal");
        assertTrue(service.cancel("Lisbon, Portugal"));
        tasks.forEach(Runnable::run);

        assertTrue(future.isCompletedExceptionally());
        assertEquals(0, service.cacheSize());
        assertFalse(service.cancel("Lisbon, Portugal"));
    }

    @Test
    void asyncHitDoesNotCallRemote() throws Exception {
        cache.set("oslo", "https://img/oslo.jpg");

        assertEquals(Optional.of("https://img/oslo.jpg"), service.imageForAsync("Oslo").get());
        verify(client, never()).findImageUrl(anyString());
    }
}
