package com.pocketca.profile;

import com.pocketca.exception.PkiException;

/**
 * Kind of identity being issued. Selected once per request.
 */
public enum IdentityProfile {
    ROOT_CA("root"),
    SUB_CA("sub"),
    SERVER("server"),
    CLIENT("client"),
    WEB_SERVER("www");
    
    private final String command;
    
    IdentityProfile(String command) {
        this.command = command;
    }
    
    /**
     * Command-line verb that selects this profile
     */
    public String getCommand() {
        return command;
    }
    
    public boolean isAuthority() {
        return this == ROOT_CA || this == SUB_CA;
    }
    
    /**
     * Look up a profile by its command-line verb.
     * 
     * @param command verb such as {@code root} or {@code www}
     * @return the matching profile
     * @throws PkiException with {@code UNKNOWN_PROFILE} for any other value
     */
    public static IdentityProfile fromCommand(String command) {
        if (command != null) {
            for (IdentityProfile profile : values()) {
                if (profile.command.equals(command)) {
                    return profile;
                }
            }
        }
        throw PkiException.unknownProfile(command);
    }
}
