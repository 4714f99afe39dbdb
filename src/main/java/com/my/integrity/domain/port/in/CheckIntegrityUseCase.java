package com.my.integrity.domain.port.in;

import com.my.integrity.domain.model.CheckResult;

public interface CheckIntegrityUseCase {
    CheckResult check(String container);
}
