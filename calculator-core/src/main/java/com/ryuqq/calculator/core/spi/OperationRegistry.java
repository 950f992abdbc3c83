package com.ryuqq.calculator.core.spi;

import com.ryuqq.calculator.core.operation.Operation;

import java.util.List;

/**
 * 사용 가능한 연산 목록 제공자.
 *
 * <p><strong>계약:</strong></p>
 * <ul>
 *   <li>반환 목록의 순서 = 메뉴 표시 순서 (1..N 번호와 일치)</li>
 *   <li>매 호출마다 같은 순서의 같은 인스턴스 반환</li>
 *   <li>반환 목록은 수정 불가</li>
 *   <li>null 요소 없음</li>
 * </ul>
 *
 * <p>연산 이름의 중복은 권장되지 않지만 강제하지 않습니다.</p>
 *
 * @author Calculator Team
 * @since 1.0.0
 */
public interface OperationRegistry {

    /**
     * 등록된 모든 연산 조회.
     *
     * @return 표시 순서대로 정렬된 수정 불가 목록 (non-null, 비어 있을 수 있음)
     */
    List<Operation> list();
}
