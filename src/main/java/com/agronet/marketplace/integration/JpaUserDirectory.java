package com.agronet.marketplace.integration;

import com.agronet.marketplace.domain.model.UserAccount;
import com.agronet.marketplace.repository.UserAccountRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * {@link UserDirectory} backed by the shared users table.
 *
 * @author Agronet Marketplace Team
 */
@Component
public class JpaUserDirectory implements UserDirectory {

    private final UserAccountRepository userAccountRepository;

    public JpaUserDirectory(UserAccountRepository userAccountRepository) {
        this.userAccountRepository = userAccountRepository;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<UserProfile> getUser(String userId) {
        if (userId == null) {
            return Optional.empty();
        }
        return userAccountRepository.findById(userId).map(JpaUserDirectory::toProfile);
    }

    private static UserProfile toProfile(UserAccount account) {
        return UserProfile.builder()
                .id(account.getId())
                .fullName(account.getFullName())
                .userType(account.getUserType())
                .verified(account.isVerified())
                .locked(account.isLocked())
                .accountStatus(account.getAccountStatus())
                .regionId(account.getRegionId())
                .build();
    }
}
