package com.knotcore.model.enums;

/**
 * Closed set of interest categories a partner can like or dislike.
 */
public enum InterestCategory {
    TRAVEL("Travel"),
    COOKING("Cooking"),
    MOVIES("Movies"),
    MUSIC("Music"),
    READING("Reading"),
    SPORTS("Sports"),
    GAMING("Gaming"),
    ART("Art"),
    PHOTOGRAPHY("Photography"),
    FITNESS("Fitness"),
    FASHION("Fashion"),
    TECHNOLOGY("Technology"),
    NATURE("Nature"),
    FOOD("Food"),
    COFFEE("Coffee"),
    WINE("Wine"),
    DANCING("Dancing"),
    THEATER("Theater"),
    CONCERTS("Concerts"),
    MUSEUMS("Museums"),
    SHOPPING("Shopping"),
    YOGA("Yoga"),
    HIKING("Hiking"),
    BEACH("Beach"),
    PETS("Pets"),
    CARS("Cars"),
    DIY("DIY"),
    GARDENING("Gardening"),
    MEDITATION("Meditation"),
    PODCASTS("Podcasts"),
    BAKING("Baking"),
    CAMPING("Camping"),
    CYCLING("Cycling"),
    RUNNING("Running"),
    SWIMMING("Swimming"),
    SKIING("Skiing"),
    SURFING("Surfing"),
    PAINTING("Painting"),
    BOARD_GAMES("Board Games"),
    KARAOKE("Karaoke");

    private final String label;

    InterestCategory(String label) {
        this.label = label;
    }

    /**
     * Display label, also used for keyword matching against candidate text.
     */
    public String getLabel() {
        return label;
    }
}
