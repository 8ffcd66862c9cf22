package org.springaicommunity.clabot;

/**
 * An automated template of the agreement service.
 *
 * @param id template id
 * @param title template title
 */
public record AgreementTemplate(String id, String title) {

}
