package com.lendingmarket.backend.modules.invitation.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.lendingmarket.backend.modules.audit.application.AuditLogService;
import com.lendingmarket.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.lendingmarket.backend.modules.auth.application.UserCapabilityService;
import com.lendingmarket.backend.modules.auth.domain.Capability;
import com.lendingmarket.backend.modules.auth.domain.UserAccount;
import com.lendingmarket.backend.modules.invitation.domain.EmailInvitation;
import com.lendingmarket.backend.modules.invitation.domain.EmailInvitationStatus;
import com.lendingmarket.backend.modules.invitation.infrastructure.persistence.EmailInvitationRepository;
import com.lendingmarket.backend.modules.loan.domain.LoanParticipant;
import com.lendingmarket.backend.modules.loan.infrastructure.persistence.LoanParticipantRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Turns email-keyed invitations into lender participations once the invitee has an account.
 * Runs on every registration and login; a second run finds nothing left to do.
 */
@Service
@Transactional
public class InvitationActivationService {

    private static final Logger log = LoggerFactory.getLogger(InvitationActivationService.class);

    private final EmailInvitationRepository emailInvitationRepository;
    private final LoanParticipantRepository loanParticipantRepository;
    private final UserCapabilityService userCapabilityService;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public InvitationActivationService(
            EmailInvitationRepository emailInvitationRepository,
            LoanParticipantRepository loanParticipantRepository,
            UserCapabilityService userCapabilityService,
            AuditLogService auditLogService,
            Clock clock
    ) {
        this.emailInvitationRepository = emailInvitationRepository;
        this.loanParticipantRepository = loanParticipantRepository;
        this.userCapabilityService = userCapabilityService;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    public ActivationResult activate(UserAccount user) {
        String email = user.getEmail();
        OffsetDateTime now = OffsetDateTime.now(clock);

        List<EmailInvitation> invitations =
                emailInvitationRepository.findByEmailAndStatus(email, EmailInvitationStatus.PENDING);
        for (EmailInvitation invitation : invitations) {
            invitation.setStatus(EmailInvitationStatus.ACTIVATED);
            invitation.setActivatedAt(now);
        }
        emailInvitationRepository.saveAll(invitations);

        List<LoanParticipant> unlinked = loanParticipantRepository.findUnlinkedByEmail(email);
        for (LoanParticipant participant : unlinked) {
            participant.setLender(user);
        }
        loanParticipantRepository.saveAll(unlinked);

        boolean lenderGranted = false;
        if (!invitations.isEmpty() || !unlinked.isEmpty()) {
            lenderGranted = userCapabilityService.grant(user, Capability.LENDER);

            Map<String, Object> detail = new LinkedHashMap<>();
            detail.put("invitationsActivated", invitations.size());
            detail.put("participantsLinked", unlinked.size());
            auditLogService.record(new AuditLogCommand(
                    "INVITATION_ACTIVATED",
                    "USER",
                    user.getId().toString(),
                    user.getId(),
                    detail
            ));
            log.info("Activated {} invitation(s) and linked {} participation(s) for user {}",
                    invitations.size(), unlinked.size(), user.getId());
        }
        return new ActivationResult(invitations.size(), unlinked.size(), lenderGranted);
    }

    public record ActivationResult(int invitationsActivated, int participantsLinked, boolean lenderGranted) {
    }
}
