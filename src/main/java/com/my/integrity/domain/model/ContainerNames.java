package com.my.integrity.domain.model;

import com.my.integrity.domain.exception.InvalidRequestException;

import java.util.regex.Pattern;

/**
 * 컨테이너 이름 규칙. 이름은 저장소 경로의 일부가 되므로 Docker 이름 규칙보다 넓게 허용하지 않는다.
 */
public final class ContainerNames {

    private static final Pattern VALID = Pattern.compile("[a-zA-Z0-9][a-zA-Z0-9_.-]{0,127}");

    private ContainerNames() {
    }

    public static boolean isValid(String name) {
        return name != null && VALID.matcher(name).matches();
    }

    public static String requireValid(String name) {
        if (!isValid(name)) {
            throw new InvalidRequestException("유효하지 않은 컨테이너 이름입니다: " + name);
        }
        return name;
    }
}
