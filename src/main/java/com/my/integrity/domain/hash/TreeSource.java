package com.my.integrity.domain.hash;

import java.io.IOException;

/**
 * 왜: 런타임 export(tar 스트림)와 호스트 디렉터리를 같은 방식으로 순회해 해시 로직을 하나로 유지하기 위함.
 *
 * <p>순회 순서는 보장하지 않는다. 정렬은 {@link ContentHasher}가 담당한다.
 */
public interface TreeSource {

    /**
     * @param rules 소스가 하위 트리를 통째로 건너뛸 때 참고할 수 있는 규칙. 최종 필터링은 해시 계산기가 다시 한다.
     */
    void accept(ExclusionRules rules, TreeVisitor visitor) throws IOException;
}
