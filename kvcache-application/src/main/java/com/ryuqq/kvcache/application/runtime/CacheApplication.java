package com.ryuqq.kvcache.application.runtime;

import com.ryuqq.kvcache.application.registry.CacheInstance;
import com.ryuqq.kvcache.core.spi.KeyValueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * 캐시 사용 진입점.
 *
 * <p>저장소는 생성자로 주입받습니다. {@link #main(String[])}만 프로세스 공유
 * {@link CacheInstance}를 연결하고, 나머지 코드는 {@link KeyValueStore}에만 의존합니다.</p>
 *
 * @author KvCache Team
 * @since 1.0.0
 */
public final class CacheApplication {

    private static final Logger log = LoggerFactory.getLogger(CacheApplication.class);

    static final String USERNAME_KEY = "username";
    static final String EMAIL_KEY = "email";

    private final KeyValueStore store;

    /**
     * 생성자.
     *
     * @param store 사용할 저장소
     * @throws IllegalArgumentException store가 null인 경우
     */
    public CacheApplication(KeyValueStore store) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        this.store = store;
    }

    /**
     * 사용자 이름을 저장하고 다시 읽은 뒤, 저장한 적 없는 이메일을 조회합니다.
     *
     * @param username 저장할 사용자 이름
     * @return 저장소에서 다시 읽은 사용자 이름
     */
    public Optional<String> run(String username) {
        store.add(USERNAME_KEY, username);

        Optional<String> cached = store.get(USERNAME_KEY);
        log.info("Username from cache: {}", cached.orElse("<absent>"));

        Optional<String> email = store.get(EMAIL_KEY);
        log.info("Email present in cache: {}", email.isPresent());

        return cached;
    }

    public static void main(String[] args) {
        String username = args.length > 0 ? args[0] : "john_doe";
        new CacheApplication(CacheInstance.getInstance()).run(username);
    }
}
