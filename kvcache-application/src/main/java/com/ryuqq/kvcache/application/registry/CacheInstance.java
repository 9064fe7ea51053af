package com.ryuqq.kvcache.application.registry;

import com.ryuqq.kvcache.adapter.inmemory.store.ConcurrentKeyValueStore;
import com.ryuqq.kvcache.core.config.StoreConfig;
import com.ryuqq.kvcache.core.exception.DuplicateInstantiationException;
import com.ryuqq.kvcache.core.spi.KeyValueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.Serial;
import java.io.Serializable;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 프로세스 전역 공유 캐시.
 *
 * <p>프로세스당 하나만 존재하며 {@link #getInstance()}로만 얻을 수 있습니다.
 * 모든 저장소 연산은 소유한 {@link ConcurrentKeyValueStore}에 위임됩니다.</p>
 *
 * <p><strong>단일 인스턴스 보장:</strong></p>
 * <ul>
 *   <li>생성: {@link InstanceRegistry}를 통한 지연 생성 (최초 접근 시)</li>
 *   <li>리플렉션 우회: 두 번째 생성자 호출 시 {@link DuplicateInstantiationException}</li>
 *   <li>복제: {@link #clone()}은 항상 {@link CloneNotSupportedException}</li>
 *   <li>역직렬화: 항상 {@link DuplicateInstantiationException}</li>
 * </ul>
 *
 * <p><strong>설정:</strong> 시스템 프로퍼티에서 {@link StoreConfig#fromProperties} 로 로드합니다.</p>
 *
 * <p>공유 인스턴스는 호출자에게 {@link KeyValueStore}로 주입하는 것을 권장합니다.
 * 테스트에서는 격리된 {@link ConcurrentKeyValueStore}를 직접 생성할 수 있습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * KeyValueStore cache = CacheInstance.getInstance();
 * cache.add("username", "john_doe");
 * cache.get("username"); // Optional[john_doe]
 * </pre>
 *
 * @author KvCache Team
 * @since 1.0.0
 */
public final class CacheInstance implements KeyValueStore, Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    private static final Logger log = LoggerFactory.getLogger(CacheInstance.class);

    private static final AtomicBoolean CREATED = new AtomicBoolean(false);

    private static final InstanceRegistry<CacheInstance> REGISTRY = new InstanceRegistry<>(
        "CacheInstance",
        () -> new CacheInstance(StoreConfig.fromProperties(System.getProperties()))
    );

    private final transient KeyValueStore store;

    private CacheInstance(StoreConfig config) {
        // 저장소 생성 실패 시 플래그가 남지 않도록 생성 후에 점유
        this.store = new ConcurrentKeyValueStore(config);
        if (!CREATED.compareAndSet(false, true)) {
            throw new DuplicateInstantiationException(CacheInstance.class,
                "an instance already exists, use CacheInstance.getInstance()");
        }
        log.info("CacheInstance created: initialCapacity={}, maxKeyLength={}",
            config.initialCapacity(), config.maxKeyLength());
    }

    /**
     * 공유 인스턴스 조회.
     *
     * @return 프로세스 전역 CacheInstance
     * @throws IllegalArgumentException 시스템 프로퍼티 설정이 잘못된 경우
     */
    public static CacheInstance getInstance() {
        return REGISTRY.get();
    }

    @Override
    public void add(String key, String value) {
        store.add(key, value);
    }

    @Override
    public Optional<String> get(String key) {
        return store.get(key);
    }

    @Override
    public void remove(String key) {
        store.remove(key);
    }

    @Override
    public boolean containsKey(String key) {
        return store.containsKey(key);
    }

    @Override
    public int size() {
        return store.size();
    }

    @Override
    public void clear() {
        store.clear();
    }

    /**
     * 복제 금지.
     *
     * @throws CloneNotSupportedException 항상
     */
    @Override
    public Object clone() throws CloneNotSupportedException {
        throw new CloneNotSupportedException("Cloning of CacheInstance is not allowed");
    }

    @Serial
    private void readObject(ObjectInputStream in) throws IOException, ClassNotFoundException {
        throw new DuplicateInstantiationException(CacheInstance.class,
            "deserialization would create a second instance");
    }
}
