package com.my.integrity.domain.hash;

import java.io.IOException;
import java.io.InputStream;

@FunctionalInterface
public interface TreeVisitor {

    /**
     * @param content 일반 파일일 때만 열려 있는 내용 스트림, 그 외에는 {@code null}. 호출이 끝나면 유효하지 않다.
     */
    void visit(TreeEntry entry, InputStream content) throws IOException;
}
