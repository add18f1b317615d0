package com.polydoc.core;

import com.polydoc.core.Vehicles.Car;
import com.polydoc.core.Vehicles.InspectedCar;
import com.polydoc.core.Vehicles.Truck;
import com.polydoc.core.Vehicles.Vehicle;
import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DocumentCodecTest {
    private DocumentCodec<Vehicle> codec;

    @BeforeEach
    void setUp() {
        codec = new DocumentCodec<>(new TypeRegistry<>(Vehicles.typeMap()));
    }

    @Test
    void dehydrateStampsSubtypesWithTheirDiscriminator() {
        Document truck = codec.dehydrate(new Truck("Actros", "T-1", 18.5));
        Document car = codec.dehydrate(new Car("Golf", "C-1", 5));

        assertEquals("Truck", truck.get(DocumentCodec.DISCRIMINATOR_KEY));
        assertFalse(car.containsKey(DocumentCodec.DISCRIMINATOR_KEY));
    }

    @Test
    void dehydrateLeavesNullFieldsOut() {
        Document truck = codec.dehydrate(new Truck("Actros", "T-1", 18.5));

        assertFalse(truck.containsKey("id"));
        assertFalse(truck.containsKey("axles"));
        assertEquals(18.5, truck.get("load"));
    }

    @Test
    void hydratePicksTheClassNamedByTheDiscriminator() {
        Document document = new Document("id", "1")
                .append("__t", "Truck")
                .append("name", "Actros")
                .append("plate", "T-1")
                .append("load", 18.5)
                .append("axles", List.of("front", "rear"));

        Vehicle vehicle = codec.hydrate(document);

        assertEquals(new Truck("1", "Actros", "T-1", 18.5, List.of("front", "rear")), vehicle);
    }

    @Test
    void hydrateUsesTheSupertypeWithoutDiscriminator() {
        Vehicle vehicle = codec.hydrate(new Document("id", "2").append("name", "Golf").append("doors", 5));

        assertEquals(new Car("2", "Golf", null, 5), vehicle);
    }

    @Test
    void hydrateIgnoresKeysTheClassDoesNotDeclare() {
        Document document = new Document("id", "2").append("name", "Golf").append("color", "red");

        assertEquals(new Car("2", "Golf", null, null), codec.hydrate(document));
    }

    @Test
    void hydrateOfNothingIsNull() {
        assertNull(codec.hydrate(null));
    }

    @Test
    void hydrateRejectsUnknownDiscriminators() {
        Document document = new Document("id", "3").append("__t", "Bike").append("name", "Brompton");

        UnregisteredConstructorException e = assertThrows(UnregisteredConstructorException.class,
                () -> codec.hydrate(document));

        assertEquals("There is no registered instance constructor for the document with ID 3", e.getMessage());
    }

    @Test
    void hydrateRejectsSupertypeDocumentsWhenTheSupertypeIsAbstract() {
        Map<String, EntityType<? extends Vehicle>> typeMap = Vehicles.typeMap();
        typeMap.put(TypeRegistry.DEFAULT, EntityType.named("Vehicle", Vehicles.VEHICLE));
        DocumentCodec<Vehicle> abstractCodec = new DocumentCodec<>(new TypeRegistry<>(typeMap));

        assertThrows(UnregisteredConstructorException.class,
                () -> abstractCodec.hydrate(new Document("id", "4").append("name", "Golf")));
        assertInstanceOf(Truck.class, abstractCodec.hydrate(new Document("id", "5").append("__t", "Truck")));
    }

    @Test
    void hydrateReadsInstantsFromDatesAndIsoStrings() {
        Instant inspected = Instant.parse("2024-03-01T10:15:30Z");

        InspectedCar fromInstant = codec.hydrate(new Document("id", "6")
                .append("__t", "InspectedCar")
                .append("inspectedAt", inspected));
        InspectedCar fromString = codec.hydrate(new Document("id", "7")
                .append("__t", "InspectedCar")
                .append("inspectedAt", "2024-03-01T10:15:30Z"));

        assertEquals(inspected, fromInstant.inspectedAt());
        assertEquals(inspected, fromString.inspectedAt());
    }

    @Test
    void hydrateReportsDocumentsThatCannotBeBound() {
        Document document = new Document("id", "8").append("name", "Golf").append("doors", "many");

        assertThrows(IllegalStateException.class, () -> codec.hydrate(document));
    }
}
