package com.clickermsu.registry.model;

import lombok.Value;

import java.util.List;

/**
 * Leading users and the registry size, taken from the same snapshot.
 */
@Value
public class TopUsers {
    List<RankedUser> users;
    long totalUsers;
}
