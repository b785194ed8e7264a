package service;

import lombok.extern.slf4j.Slf4j;
import model.Entry;
import model.Key;

import java.time.Clock;
import java.time.Duration;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 키-값 저장소와 만료 시간 관리를 담당하는 서비스 클래스
 *
 * <p>각 연산은 키 단위로 원자적입니다. 만료된 엔트리는 없는 것으로 취급되며,
 * 이를 발견한 {@link #get} 호출이 저장소에서 제거합니다.
 */
@Slf4j
public class StorageService {

    // 키 단위 잠금은 ConcurrentHashMap의 compute 계열 연산이 담당
    private final Map<Key, Entry> store = new ConcurrentHashMap<>();
    private final Clock clock;

    public StorageService() {
        this(Clock.systemUTC());
    }

    public StorageService(Clock clock) {
        this.clock = clock;
    }

    /**
     * 키-값을 저장합니다. 기존 값과 만료 시간은 무조건 대체됩니다.
     *
     * @param ttl 만료까지의 시간, 없으면 null
     */
    public void set(Key key, byte[] value, Duration ttl) {
        Long expiresAt = ttl == null ? null : expiryTime(ttl);
        store.put(key, new Entry(value, expiresAt));
        log.trace("Stored: {} (expires at: {})", key, expiresAt);
    }

    public void set(Key key, byte[] value) {
        set(key, value, null);
    }

    /**
     * 키에 해당하는 값을 가져옵니다. 만료된 키는 삭제하고 null을 반환합니다.
     */
    public byte[] get(Key key) {
        long now = clock.millis();
        Entry entry = store.computeIfPresent(key, (k, current) -> {
            if (current.isExpired(now)) {
                log.trace("Key expired and removed: {}", k);
                return null;
            }
            return current;
        });
        return entry == null ? null : entry.value();
    }

    private long expiryTime(Duration ttl) {
        long now = clock.millis();
        long millis = ttl.toMillis();
        return millis > Long.MAX_VALUE - now ? Long.MAX_VALUE : now + millis;
    }

    /**
     * 만료된 키들을 정리하고 제거한 개수를 반환합니다.
     */
    public int evictExpired() {
        long now = clock.millis();
        int removed = 0;
        for (Iterator<Map.Entry<Key, Entry>> it = store.entrySet().iterator(); it.hasNext(); ) {
            Map.Entry<Key, Entry> e = it.next();
            // 순회 중 다른 연결이 새 값으로 덮어썼다면 그 값은 남겨둠
            if (e.getValue().isExpired(now) && store.remove(e.getKey(), e.getValue())) {
                removed++;
            }
        }
        if (removed > 0) {
            log.trace("Evicted {} expired keys", removed);
        }
        return removed;
    }

    /**
     * 물리적으로 남아 있는 엔트리 개수 (아직 정리되지 않은 만료 키 포함)
     */
    public int size() {
        return store.size();
    }
}
