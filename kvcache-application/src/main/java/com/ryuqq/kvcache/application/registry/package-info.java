/**
 * 단일 인스턴스 관리 패키지.
 *
 * <h2>구성 요소</h2>
 * <ul>
 *   <li>{@link com.ryuqq.kvcache.application.registry.InstanceRegistry} - 지연 생성, 경쟁 안전한 1회 초기화</li>
 *   <li>{@link com.ryuqq.kvcache.application.registry.CacheInstance} - 프로세스 전역 공유 캐시</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * application (CacheInstance, InstanceRegistry)
 *   ↓ owns
 * adapter-inmemory (ConcurrentKeyValueStore)
 *   ↓ implements
 * core (KeyValueStore, CacheKey, StoreConfig)
 * </pre>
 *
 * @author KvCache Team
 * @since 1.0.0
 */
package com.ryuqq.kvcache.application.registry;
