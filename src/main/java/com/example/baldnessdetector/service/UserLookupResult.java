package com.example.baldnessdetector.service;

import com.example.baldnessdetector.model.User;
import lombok.Value;

@Value
public class UserLookupResult {
    User user;
    /** True only for the call that inserted the row. */
    boolean newUser;
}
