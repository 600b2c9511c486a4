package dev.aparikh.torrentsearch.search;

public class UnknownUserException extends SearchNotFoundException {

    public UnknownUserException(long userId) {
        super("No user with id " + userId);
    }
}
