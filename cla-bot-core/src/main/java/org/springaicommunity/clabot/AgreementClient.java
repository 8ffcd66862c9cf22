package org.springaicommunity.clabot;

import java.util.List;
import java.util.Optional;

/**
 * Operations the bot performs on the external agreement (e-signature) service.
 *
 * <p>
 * Failures surface as {@link AgreementServiceException} unless a method documents a
 * degraded result instead.
 */
public interface AgreementClient {

	/**
	 * Create an agreement from the configured template and invite the contributor to
	 * sign it.
	 * @param request contributor and origin details
	 * @return reference of the new agreement
	 */
	String createAgreement(AgreementRequest request);

	/**
	 * Fetch an agreement by reference.
	 * @return the agreement, or empty if the service no longer knows it
	 */
	Optional<AgreementSummary> getAgreement(String agreementRef);

	/**
	 * Find a signed, in-force agreement for a signer email.
	 * @return the agreement, or empty if there is none or the search failed
	 */
	Optional<AgreementSummary> findCurrentAgreementByEmail(String email);

	/**
	 * Send the signing invitation for an existing agreement again.
	 */
	void resendInvitation(String agreementRef, String email, String name, String username);

	/**
	 * Automated templates available to the organization.
	 */
	List<AgreementTemplate> listTemplates();

}
