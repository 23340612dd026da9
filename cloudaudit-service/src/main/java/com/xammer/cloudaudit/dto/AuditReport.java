package com.xammer.cloudaudit.dto;

import com.xammer.cloudaudit.domain.CollectionError;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AuditReport {
    private String auditedAccount;
    private String partition;
    private List<String> services;
    private List<String> checks;
    private List<CheckFinding> findings;
    private List<CollectionError> collectionErrors;

    public long countByStatus(CheckFinding.Status status) {
        return findings.stream().filter(f -> f.getStatus() == status).count();
    }
}
