package com.polydoc.core;

import com.polydoc.core.Vehicles.Bike;
import com.polydoc.core.Vehicles.Car;
import com.polydoc.core.Vehicles.InspectedCar;
import com.polydoc.core.Vehicles.Truck;
import com.polydoc.core.Vehicles.Vehicle;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class TypeRegistryTest {

    @Test
    void supertypeIsNamedAfterItsClass() {
        TypeRegistry<Vehicle> registry = new TypeRegistry<>(Vehicles.typeMap());

        assertEquals("Car", registry.supertypeName());
        assertEquals(Car.class, registry.supertypeConstructor().orElseThrow());
        assertEquals(List.of("Truck", "InspectedCar"),
                registry.subtypeEntries().stream().map(TypeRegistry.Entry::name).collect(Collectors.toList()));
    }

    @Test
    void mapWithoutSupertypeIsRejected() {
        Map<String, EntityType<? extends Vehicle>> typeMap = Vehicles.typeMap();
        typeMap.remove(TypeRegistry.DEFAULT);

        InvalidArgumentException e = assertThrows(InvalidArgumentException.class, () -> new TypeRegistry<>(typeMap));

        assertEquals("The given map must include domain supertype data", e.getMessage());
        assertThrows(InvalidArgumentException.class, () -> new TypeRegistry<Vehicle>(null));
    }

    @Test
    void abstractSupertypeNeedsAName() {
        Map<String, EntityType<? extends Vehicle>> typeMap = Vehicles.typeMap();
        typeMap.put(TypeRegistry.DEFAULT, EntityType.named(null, Vehicles.VEHICLE));

        InvalidArgumentException e = assertThrows(InvalidArgumentException.class, () -> new TypeRegistry<>(typeMap));

        assertEquals("Either a base class must be provided or the model name must be specified in the options",
                e.getMessage());
    }

    @Test
    void abstractSupertypeFallsBackToTheModelName() {
        Map<String, EntityType<? extends Vehicle>> typeMap = Vehicles.typeMap();
        typeMap.put(TypeRegistry.DEFAULT, EntityType.named(null, Vehicles.VEHICLE));

        TypeRegistry<Vehicle> registry = new TypeRegistry<>(typeMap, "Vehicle");

        assertEquals("Vehicle", registry.supertypeName());
        assertTrue(registry.supertypeConstructor().isEmpty());
        assertTrue(registry.contains("Vehicle"));
    }

    @Test
    void explicitSupertypeNameWinsOverTheModelName() {
        Map<String, EntityType<? extends Vehicle>> typeMap = Vehicles.typeMap();
        typeMap.put(TypeRegistry.DEFAULT, EntityType.named("Machine", Vehicles.VEHICLE));

        assertEquals("Machine", new TypeRegistry<>(typeMap, "Vehicle").supertypeName());
    }

    @Test
    void subtypesNeedAClass() {
        Map<String, EntityType<? extends Vehicle>> typeMap = Vehicles.typeMap();
        typeMap.put("Van", EntityType.named("Van", Schema.empty()));

        assertThrows(InvalidArgumentException.class, () -> new TypeRegistry<>(typeMap));
    }

    @Test
    void subtypeNamesMustDifferFromTheSupertypeName() {
        Map<String, EntityType<? extends Vehicle>> typeMap = new LinkedHashMap<>(Vehicles.typeMap());
        typeMap.put("Car", EntityType.of(Truck.class, Vehicles.TRUCK));

        assertThrows(InvalidArgumentException.class, () -> new TypeRegistry<>(typeMap));
    }

    @Test
    void resolveCoversSupertypeAndSubtypes() {
        TypeRegistry<Vehicle> registry = new TypeRegistry<>(Vehicles.typeMap());

        assertEquals(Car.class, registry.resolve("Car").orElseThrow().type());
        assertEquals(Truck.class, registry.resolve("Truck").orElseThrow().type());
        assertTrue(registry.resolve("Bike").isEmpty());
        assertTrue(registry.resolve(null).isEmpty());
        assertFalse(registry.contains(null));
        assertTrue(registry.isSubtype("Truck"));
        assertFalse(registry.isSubtype("Car"));
    }

    @Test
    void nameOfOnlyMatchesRegisteredClassesExactly() {
        TypeRegistry<Vehicle> registry = new TypeRegistry<>(Vehicles.typeMap());

        assertEquals("Car", registry.nameOf(Car.class).orElseThrow());
        assertEquals("InspectedCar", registry.nameOf(InspectedCar.class).orElseThrow());
        assertTrue(registry.nameOf(Bike.class).isEmpty());
        assertTrue(registry.nameOf(null).isEmpty());
    }

    @Test
    void subtypeSchemasExtendTheSupertypeSchema() {
        TypeRegistry<Vehicle> registry = new TypeRegistry<>(Vehicles.typeMap());

        List<String> truckFields = registry.schemaOf("Truck").fields().stream()
                .map(Schema.Field::name)
                .collect(Collectors.toList());

        assertEquals(List.of("name", "plate", "load"), truckFields);
        assertSame(Vehicles.VEHICLE, registry.schemaOf("Car"));
    }

    @Test
    void auditabilityFollowsTheRegisteredClass() {
        TypeRegistry<Vehicle> registry = new TypeRegistry<>(Vehicles.typeMap());

        assertTrue(registry.isAuditable("InspectedCar"));
        assertFalse(registry.isAuditable("Car"));
        assertFalse(registry.isAuditable("Bike"));
    }
}
