package ai.legaldoc.reviser.amend;

/**
 * Prompt sent to the language model for a single repeal: {@link #SYSTEM_PERSONA} as the system message and
 * {@link #build} as the user message. The two worked examples pin down the output
 * contract: the targeted stav is dropped, the header gets a trailing {@code *}, every other paragraph is
 * kept verbatim and in order, one per line.
 */
final class AmendmentPrompt {

    static final String SYSTEM_PERSONA = "You are a precise legal document editor for Serbian laws.";

    private static final String INSTRUCTIONS = """
You are an expert in Serbian legislative amendments. Apply the changes to the old article text exactly as per the instruction.
If it says a stav 'prestaju da važe' (ceases to be valid), delete that stav from the text and append '*' to the article title.
The 'stav' number refers to the (number)th paragraph after the title.
Return only the updated text, using new lines for paragraphs/stavs, preserving structure.
""";

    private static final String EXAMPLE_ONE = """
Example 1:
Old text:
Član 9
Knjiženje poslovnih promena i događaja (u daljem tekstu: poslovnih promena) na računima imovine, obaveza, kapitala, prihoda i rashoda vrši se na osnovu verodostojnih računovodstvenih isprava.
Računovodstvena isprava predstavlja pisani dokument ili elektronski zapis o nastaloj poslovnoj promeni, koja obuhvata sve podatke potrebne za knjiženje u poslovnim knjigama tako da se iz računovodstvene isprave nedvosmisleno može saznati osnov, vrsta i sadržaj poslovne promene.
Faktura (račun) kao računovodstvena isprava, u smislu ovog zakona, sastavlja se i dostavlja pravnim licima i preduzetnicima u elektronskom obliku i mora biti potvrđena od strane odgovornog lica koje svojim potpisom ili drugom identifikacionom oznakom (utvrđenom opštim aktom kojim pravno lice, odnosno preduzetnik uređuje organizaciju računovodstva) potvrđuje njenu verodostojnost.
Računovodstvena isprava sastavlja se u potrebnom broju primeraka na mestu i u vreme nastanka poslovne promene.
Računovodstvena isprava koja je sastavljena u jednom primerku može se otpremiti ako su podaci iz te isprave stalno dostupni.
Fotokopija računovodstvene isprave je osnov za knjiženje poslovne promene, pod uslovom da je na njoj navedeno mesto čuvanja originalne isprave i da je potvrđena od strane odgovornog lica koji svojim potpisom ili drugom identifikacionom oznakom potvrđuje njenu verodostojnost.
Računovodstvenom ispravom smatra se i isprava ispostavljena, odnosno primljena telekomunikacionim putem, kao i isprava ispostavljena, odnosno primljena putem servisa za elektronsku razmenu podataka (Electronic data Interchange - EDI).
Pošiljalac je odgovoran da podaci na ulazu u telekomunikacioni sistem budu zasnovani na računovodstvenim ispravama, kao i da čuva originalne računovodstvene isprave.
Kada se računovodstvena isprava prenosi putem servisa za elektronsku razmenu podataka, pružalac usluge elektronske razmene podataka dužan je da obezbedi integritet razmenjenih podataka.
Instruction: člana 9. stav 3. Zakona o računovodstvu prestaje da važe
Updated:
Član 9*
Knjiženje poslovnih promena i događaja (u daljem tekstu: poslovnih promena) na računima imovine, obaveza, kapitala, prihoda i rashoda vrši se na osnovu verodostojnih računovodstvenih isprava.
Računovodstvena isprava predstavlja pisani dokument ili elektronski zapis o nastaloj poslovnoj promeni, koja obuhvata sve podatke potrebne za knjiženje u poslovnim knjigama tako da se iz računovodstvene isprave nedvosmisleno može saznati osnov, vrsta i sadržaj poslovne promene.
Računovodstvena isprava sastavlja se u potrebnom broju primeraka na mestu i u vreme nastanka poslovne promene.
Računovodstvena isprava koja je sastavljena u jednom primerku može se otpremiti ako su podaci iz te isprave stalno dostupni.
Fotokopija računovodstvene isprave je osnov za knjiženje poslovne promene, pod uslovom da je na njoj navedeno mesto čuvanja originalne isprave i da je potvrđena od strane odgovornog lica koji svojim potpisom ili drugom identifikacionom oznakom potvrđuje njenu verodostojnost.
Računovodstvenom ispravom smatra se i isprava ispostavljena, odnosno primljena telekomunikacionim putem, kao i isprava ispostavljena, odnosno primljena putem servisa za elektronsku razmenu podataka (Electronic data Interchange - EDI).
Pošiljalac je odgovoran da podaci na ulazu u telekomunikacioni sistem budu zasnovani na računovodstvenim ispravama, kao i da čuva originalne računovodstvene isprave.
Kada se računovodstvena isprava prenosi putem servisa za elektronsku razmenu podataka, pružalac usluge elektronske razmene podataka dužan je da obezbedi integritet razmenjenih podataka.
""";

    private static final String EXAMPLE_TWO = """
Example 2:
Old text:
Član 64
Odredbe člana 4. stav 7, člana 32. stav 4. tačka 2), člana 39. stav 3. tačka 2) i člana 40. stav 5. tačka 4) ovog zakona primenjuju se od dana prijema Republike Srbije u Evropsku uniju.
Odredbe člana 6. st. 13. i 14, člana 29, čl. 44-49, čl. 51. i 52. ovog zakona, počeće da se primenjuju od finansijskih izveštaja koji se sastavljaju na dan 31. decembra 2021. godine.
Odredba člana 9. stav 3. ovog zakona primenjuje se počev od 1. januara 2022. godine.
Instruction: člana 64. stav 3. Zakona o računovodstvu prestaje da važe
Updated:
Član 64*
Odredbe člana 4. stav 7, člana 32. stav 4. tačka 2), člana 39. stav 3. tačka 2) i člana 40. stav 5. tačka 4) ovog zakona primenjuju se od dana prijema Republike Srbije u Evropsku uniju.
Odredbe člana 6. st. 13. i 14, člana 29, čl. 44-49, čl. 51. i 52. ovog zakona, počeće da se primenjuju od finansijskih izveštaja koji se sastavljaju na dan 31. decembra 2021. godine.
""";

    private AmendmentPrompt() {
    }

    static String build(String articleText, String instruction) {
        return INSTRUCTIONS + "\n"
                + EXAMPLE_ONE + "\n"
                + EXAMPLE_TWO + "\n"
                + "Now apply:\n"
                + "Old text:\n" + articleText + "\n\n"
                + "Instruction:\n" + instruction + "\n";
    }
}
