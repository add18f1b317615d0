package com.polydoc.repos.certification.domain;

import com.polydoc.core.Auditable;

public interface AuditablePublication extends Auditable {
    String title();

    String isbn();
}
