package org.trump304.model.game;

/**
 * A card on the table. {@code trump} is fixed when the card is played: a trump-suit
 * card only counts as trump if the trump was already revealed at that moment.
 */
public record TrickCard(int seat, Card card, boolean trump) {}
