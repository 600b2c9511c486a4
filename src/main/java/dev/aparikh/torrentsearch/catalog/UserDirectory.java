package dev.aparikh.torrentsearch.catalog;

public interface UserDirectory {

    boolean userExists(long userId);
}
