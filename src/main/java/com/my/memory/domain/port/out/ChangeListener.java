package com.my.memory.domain.port.out;

import com.my.memory.domain.model.ChangeEvent;

import java.util.List;

/**
 * 파일 감시기가 정리된 변경 묶음을 넘기는 콜백.
 */
public interface ChangeListener {

    void onChanges(List<ChangeEvent> events);

    /**
     * 이벤트 유실 가능성이 있을 때 호출된다. 수신자는 전체 재스캔으로 복구한다.
     */
    void onOverflow(String reason);
}
