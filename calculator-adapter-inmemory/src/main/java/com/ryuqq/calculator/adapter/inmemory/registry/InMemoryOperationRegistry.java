package com.ryuqq.calculator.adapter.inmemory.registry;

import com.ryuqq.calculator.core.operation.Addition;
import com.ryuqq.calculator.core.operation.Division;
import com.ryuqq.calculator.core.operation.Multiplication;
import com.ryuqq.calculator.core.operation.Operation;
import com.ryuqq.calculator.core.operation.SquareRoot;
import com.ryuqq.calculator.core.operation.Subtraction;
import com.ryuqq.calculator.core.spi.OperationRegistry;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * In-memory implementation of {@link OperationRegistry} SPI.
 *
 * <p>Holds a fixed, ordered listing built once at startup. The listing is copied on
 * construction and exposed as an unmodifiable view, so every {@link #list()} call returns
 * the same instances in the same order.</p>
 *
 * <p><strong>Standard Listing (menu order):</strong></p>
 * <ol>
 *   <li>Addition</li>
 *   <li>Subtraction</li>
 *   <li>Multiplication</li>
 *   <li>Division</li>
 *   <li>Square root</li>
 * </ol>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * OperationRegistry registry = InMemoryOperationRegistry.standard();
 * List&lt;Operation&gt; operations = registry.list();   // [Addition, Subtraction, ...]
 *
 * // Custom ordering
 * OperationRegistry custom = InMemoryOperationRegistry.of(new Division(), new Addition());
 * </pre>
 *
 * @author Calculator Team
 * @since 1.0.0
 */
public final class InMemoryOperationRegistry implements OperationRegistry {

    private final List<Operation> operations;

    /**
     * 생성자.
     *
     * @param operations 표시 순서대로 정렬된 연산 목록 (비어 있을 수 있음)
     * @throws IllegalArgumentException operations가 null이거나 null 요소를 포함한 경우
     */
    public InMemoryOperationRegistry(List<? extends Operation> operations) {
        if (operations == null) {
            throw new IllegalArgumentException("operations cannot be null");
        }
        List<Operation> copy = new ArrayList<>(operations.size());
        for (int i = 0; i < operations.size(); i++) {
            Operation operation = operations.get(i);
            if (operation == null) {
                throw new IllegalArgumentException("operations cannot contain null (index: " + i + ")");
            }
            copy.add(operation);
        }
        this.operations = Collections.unmodifiableList(copy);
    }

    /**
     * 기본 연산 목록으로 생성.
     *
     * @return Addition, Subtraction, Multiplication, Division, Square root 순서의 레지스트리
     */
    public static InMemoryOperationRegistry standard() {
        return new InMemoryOperationRegistry(List.of(
            new Addition(),
            new Subtraction(),
            new Multiplication(),
            new Division(),
            new SquareRoot()
        ));
    }

    /**
     * 주어진 순서로 생성.
     *
     * @param operations 표시 순서대로 나열한 연산
     * @return 레지스트리
     * @throws IllegalArgumentException operations가 null이거나 null 요소를 포함한 경우
     */
    public static InMemoryOperationRegistry of(Operation... operations) {
        if (operations == null) {
            throw new IllegalArgumentException("operations cannot be null");
        }
        return new InMemoryOperationRegistry(Arrays.asList(operations));
    }

    @Override
    public List<Operation> list() {
        return operations;
    }

    /**
     * 등록된 연산 개수.
     *
     * @return 연산 개수
     */
    public int size() {
        return operations.size();
    }

    @Override
    public String toString() {
        return "InMemoryOperationRegistry{" + operations + '}';
    }
}
