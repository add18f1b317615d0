package com.polydoc.core;

import com.polydoc.core.Vehicles.Car;
import com.polydoc.core.Vehicles.Truck;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EntityTest {

    @Test
    void identityIsTheId() {
        Car car = new Car("1", "Golf", "C-1", 5);

        assertTrue(car.sameIdentityAs(new Car("1", "Polo", "C-2", 3)));
        assertTrue(car.sameIdentityAs(new Truck("1", "Actros", "T-1", 18.5, null)));
        assertFalse(car.sameIdentityAs(new Car("2", "Golf", "C-1", 5)));
    }

    @Test
    void unsavedEntitiesHaveNoIdentity() {
        Car unsaved = new Car("Golf", "C-1", 5);

        assertFalse(unsaved.sameIdentityAs(unsaved));
        assertFalse(new Car("1", "Golf", "C-1", 5).sameIdentityAs(null));
    }
}
