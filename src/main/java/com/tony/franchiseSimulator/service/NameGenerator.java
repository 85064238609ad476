package com.tony.franchiseSimulator.service;

import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class NameGenerator {

    private static final List<String> FIRST_NAMES = List.of(
            // Américains
            "Jake", "Mike", "Chris", "Matt", "Ryan", "Josh", "Tyler", "Brandon", "Justin", "Kyle",
            "Derek", "Kevin", "Adam", "Jason", "Brian", "Eric", "Andrew", "David", "James", "Marcus",
            "Terrence", "Darius", "DeShawn", "Jamal", "Antonio",
            // Latinos
            "Jose", "Juan", "Carlos", "Luis", "Pedro", "Rafael", "Fernando", "Roberto", "Eduardo", "Andres",
            "Diego", "Alejandro", "Gabriel", "Ricardo", "Victor", "Angel", "Francisco", "Manuel", "Hector", "Miguel",
            // Asiatiques
            "Hiroshi", "Kenji", "Takeshi", "Yuki", "Shohei", "Kenta", "Masahiro", "Daisuke", "Ichiro", "Hideki",
            "Min-ho", "Sung-jin", "Ji-hoon", "Hyun-woo", "Wei", "Ming", "Lei");

    private static final List<String> LAST_NAMES = List.of(
            "Johnson", "Williams", "Brown", "Jones", "Miller", "Davis", "Wilson", "Moore", "Taylor", "Anderson",
            "Thomas", "Jackson", "White", "Harris", "Martin", "Thompson", "Robinson", "Clark", "Lewis", "Walker",
            "Hall", "Allen", "Young", "King", "Wright", "Scott",
            "Gonzalez", "Lopez", "Hernandez", "Ramirez", "Torres", "Flores", "Rivera", "Gomez", "Sanchez", "Morales",
            "Ortiz", "Diaz", "Cruz", "Reyes", "Vargas", "Castillo", "Mendez", "Ramos", "Herrera", "Medina",
            "Garcia", "Martinez", "Rodriguez",
            "Suzuki", "Tanaka", "Yamamoto", "Watanabe", "Nakamura", "Kobayashi", "Takahashi", "Saito", "Matsui",
            "Kim", "Park", "Lee", "Choi", "Jung", "Kang", "Chen", "Wang", "Zhang", "Liu");

    public String firstName(RandomSource random) {
        return pick(FIRST_NAMES, random);
    }

    public String lastName(RandomSource random) {
        return pick(LAST_NAMES, random);
    }

    private String pick(List<String> names, RandomSource random) {
        int index = (int) Math.floor(random.next() * names.size());
        return names.get(Math.min(index, names.size() - 1));
    }
}
