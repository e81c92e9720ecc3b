package com.example.interview.model;

/**
 * Improved exemplar answer.
 *
 * @param text            exemplar text
 * @param framework       framework label the exemplar follows
 * @param selectionReason why that framework fits
 */
public record ModelAnswer(String text, String framework, String selectionReason) {

    public ModelAnswer {
        if (text == null) text = "";
        if (framework == null) framework = "";
        if (selectionReason == null) selectionReason = "";
    }

    public ModelAnswer withText(String newText) {
        return new ModelAnswer(newText, framework, selectionReason);
    }
}
