/**
 * Reusable contract tests for {@link com.ryuqq.collections.core.circular.CircularBuffer} implementations.
 *
 * <p>Extend {@link com.ryuqq.collections.testkit.contract.AbstractCircularBufferContractTest}
 * from a test source set and provide a factory for the implementation under test.</p>
 *
 * @author Collections Team
 * @since 1.0.0
 */
package com.ryuqq.collections.testkit.contract;
