/**
 * Contract test infrastructure for {@link com.ryuqq.kvcache.core.spi.KeyValueStore} implementations.
 *
 * <ul>
 *   <li>{@link com.ryuqq.kvcache.testkit.contract.AbstractKeyValueStoreContractTest} - inherited contract tests</li>
 *   <li>{@link com.ryuqq.kvcache.testkit.contract.ConcurrentWorkload} - multi-threaded add/get harness with write log</li>
 * </ul>
 *
 * @author KvCache Team
 * @since 1.0.0
 */
package com.ryuqq.kvcache.testkit.contract;
