package com.variantforge.controllers;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.io.FileNotFoundException;
import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

class ControllerTest {

    @Test
    void errorBodyFallsBackToExceptionName() {
        assertEquals("boom", Controller.errorBody(new IllegalStateException("boom")).get("error"));
        assertEquals("NullPointerException", Controller.errorBody(new NullPointerException()).get("error"));
        assertEquals("IOException", Controller.errorBody(new IOException(" ")).get("error"));
    }

    @Test
    void statusFollowsExceptionType() {
        JsonProcessingException badJson = assertThrows(JsonProcessingException.class,
            () -> new ObjectMapper().readTree("{\"open\":"));

        assertEquals(404, Controller.statusFor(new FileNotFoundException("x")));
        assertEquals(403, Controller.statusFor(new SecurityException("x")));
        assertEquals(400, Controller.statusFor(new IllegalArgumentException("x")));
        assertEquals(400, Controller.statusFor(badJson));
        assertEquals(500, Controller.statusFor(new IOException("disk")));
    }
}
