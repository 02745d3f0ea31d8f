package com.wpanther.licensing.dto;

import com.wpanther.licensing.entity.UserAccount;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserSummary {
    private String id;
    private String email;
    private String fullName;
    private String companyId;
    private String tenantId;
    private boolean orgAdmin;
    private boolean superUser;

    public static UserSummary from(UserAccount user) {
        return UserSummary.builder()
                .id(user.getId())
                .email(user.getEmail())
                .fullName(user.getFullName())
                .companyId(user.getCompanyId())
                .tenantId(user.getTenantId())
                .orgAdmin(user.isOrgAdmin())
                .superUser(user.isSuperUser())
                .build();
    }
}
