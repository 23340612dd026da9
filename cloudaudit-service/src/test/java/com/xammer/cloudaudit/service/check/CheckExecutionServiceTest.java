package com.xammer.cloudaudit.service.check;

import com.xammer.cloudaudit.dto.CheckFinding;
import com.xammer.cloudaudit.service.check.iam.IamPasswordPolicyMinimumLength14Check;
import com.xammer.cloudaudit.service.collector.AuditInventory;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.services.iam.model.PasswordPolicy;

import java.util.List;
import java.util.Map;

import static com.xammer.cloudaudit.service.collector.InventoryFixtures.iam;
import static com.xammer.cloudaudit.service.collector.InventoryFixtures.inventory;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CheckExecutionServiceTest {

    private final AuditInventory inventory = inventory(Map.of("iam",
            iam(PasswordPolicy.builder().minimumPasswordLength(16).build())));

    @Test
    void runsSelectedImplementedChecks() {
        CheckExecutionService service = new CheckExecutionService(List.of(new IamPasswordPolicyMinimumLength14Check()));

        List<CheckFinding> findings = service.execute(
                List.of("iam_password_policy_minimum_length_14", "iam_password_policy_symbol"), inventory);

        assertThat(findings).extracting(CheckFinding::getCheckId)
                .containsExactly("iam_password_policy_minimum_length_14");
        assertThat(service.isExecutable("iam_password_policy_symbol")).isFalse();
    }

    @Test
    void checkOfUncollectedServiceIsSkipped() {
        SecurityCheck backupCheck = mock(SecurityCheck.class);
        when(backupCheck.getCheckId()).thenReturn("backup_vaults_exist");
        when(backupCheck.getService()).thenReturn("backup");
        CheckExecutionService service = new CheckExecutionService(List.of(backupCheck));

        assertThat(service.execute(List.of("backup_vaults_exist"), inventory)).isEmpty();
        verify(backupCheck, never()).execute(any());
    }

    @Test
    void failingCheckDoesNotStopTheOthers() {
        SecurityCheck broken = mock(SecurityCheck.class);
        when(broken.getCheckId()).thenReturn("iam_broken");
        when(broken.getService()).thenReturn("iam");
        when(broken.execute(any())).thenThrow(new IllegalStateException("boom"));
        CheckExecutionService service = new CheckExecutionService(
                List.of(broken, new IamPasswordPolicyMinimumLength14Check()));

        List<CheckFinding> findings = service.execute(
                List.of("iam_broken", "iam_password_policy_minimum_length_14"), inventory);

        assertThat(findings).extracting(CheckFinding::getStatus).containsExactly(CheckFinding.Status.PASS);
    }
}
