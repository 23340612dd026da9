package com.xammer.cloudaudit.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CheckFinding {

    public enum Status {
        PASS,
        FAIL
    }

    private String checkId;
    private String service;
    private Status status;
    private String region;
    private String resourceId;
    private String resourceArn;
    private String statusExtended;
}
