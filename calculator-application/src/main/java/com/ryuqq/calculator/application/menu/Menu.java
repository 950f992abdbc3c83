package com.ryuqq.calculator.application.menu;

import com.ryuqq.calculator.core.operation.Operation;
import com.ryuqq.calculator.core.selection.Selection;

import java.util.List;

/**
 * 연산 목록을 보여주고 사용자의 선택을 받는 메뉴.
 *
 * <p><strong>동작 방식:</strong></p>
 * <ol>
 *   <li>헤더 출력</li>
 *   <li>연산마다 {@code "<1-based 인덱스>. <이름>"} 한 줄 출력 (목록 순서 유지)</li>
 *   <li>프롬프트 출력 후 한 줄 입력</li>
 *   <li>{@link Selection#resolve(String, List)}로 해석</li>
 * </ol>
 *
 * <p>잘못된 입력에 대해 예외를 던지지 않고
 * {@link com.ryuqq.calculator.core.selection.InvalidSelection}을 반환합니다.</p>
 *
 * @author Calculator Team
 * @since 1.0.0
 */
public interface Menu {

    /**
     * 메뉴를 표시하고 선택을 반환.
     *
     * @param operations 표시할 연산 목록 (표시 순서)
     * @return 선택 결과 (non-null)
     * @throws IllegalArgumentException operations가 null인 경우
     * @throws java.io.UncheckedIOException 입력을 읽는 중 I/O 오류가 발생한 경우
     */
    Selection select(List<Operation> operations);
}
