package com.shoplytic.ai.model;

public enum ToolChoice {
    /** The model decides whether to call a tool. */
    AUTO,
    /** The model must answer in text. */
    NONE
}
