/**
 * 캐시 도메인 모델 패키지.
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.kvcache.core.model.CacheKey} - 검증된 캐시 키</li>
 * </ul>
 *
 * @author KvCache Team
 * @since 1.0.0
 */
package com.ryuqq.kvcache.core.model;
