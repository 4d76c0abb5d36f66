package com.piscanner.agent;

record StreamFragment(Tier tier, String text) {

    enum Tier {
        RESULT,
        CONTENT
    }
}
