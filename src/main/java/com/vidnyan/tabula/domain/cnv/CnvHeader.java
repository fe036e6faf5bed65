package com.vidnyan.tabula.domain.cnv;

/**
 * Format parameters declared on the first line of a CNV document.
 *
 * @param declaredCount number of categories the file claims to define (informational)
 * @param codeLength    fixed width of the codes (informational)
 * @param letterCodes   codes are alphabetic and never parsed as integers
 */
public record CnvHeader(
    int declaredCount,
    int codeLength,
    boolean letterCodes
) {}
