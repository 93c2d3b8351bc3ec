package de.mirkosertic.lawnotes.model;

/**
 * Outbound citation found in a statute body, e.g. {@code 民法第九十条}.
 *
 * @param sourceLaw title of the statute containing the citation
 * @param lawTitle  cited statute, already resolved against the dictionary where possible
 * @param article   article token such as {@code 第九十条}
 */
public record LawRef(String sourceLaw, String lawTitle, String article) {
}
