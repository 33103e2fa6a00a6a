package com.knotcore.model.domain;

import com.knotcore.model.enums.FeedbackAction;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * One feedback event joined with the dimension values of the recommendation it refers to.
 */
@Value
@Builder
public class FeedbackSignal {
    FeedbackAction action;
    Integer rating;
    String recommendationType;
    List<String> interests;
    List<String> vibes;
    List<String> loveLanguages;
}
