package com.eyelevel.bordereaux.service.file.view;

import com.eyelevel.bordereaux.model.BordereauxFile;
import com.eyelevel.bordereaux.model.FileStatus;
import org.springframework.data.jpa.domain.Specification;

import java.time.LocalDateTime;
import java.util.Locale;

/**
 * Filters for the file list. A {@code null} argument yields a specification that matches everything.
 */
final class BordereauxFileSpecifications {

    private BordereauxFileSpecifications() {
    }

    static Specification<BordereauxFile> hasStatus(FileStatus status) {
        return (root, query, cb) -> status == null ? null : cb.equal(root.get("status"), status);
    }

    static Specification<BordereauxFile> senderContains(String sender) {
        return (root, query, cb) -> sender == null || sender.isBlank()
                ? null
                : cb.like(cb.lower(root.get("sender")), "%" + sender.trim().toLowerCase(Locale.ROOT) + "%");
    }

    static Specification<BordereauxFile> createdFrom(LocalDateTime from) {
        return (root, query, cb) -> from == null ? null : cb.greaterThanOrEqualTo(root.get("createdAt"), from);
    }

    static Specification<BordereauxFile> createdBefore(LocalDateTime to) {
        return (root, query, cb) -> to == null ? null : cb.lessThan(root.get("createdAt"), to);
    }
}
